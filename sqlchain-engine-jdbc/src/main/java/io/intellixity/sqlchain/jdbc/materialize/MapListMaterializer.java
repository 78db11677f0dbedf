package io.intellixity.sqlchain.jdbc.materialize;

import io.intellixity.sqlchain.spi.DesiredColumns;
import io.intellixity.sqlchain.spi.ExecutionToken;
import io.intellixity.sqlchain.spi.Materializer;
import io.intellixity.sqlchain.spi.RowCursor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Every row as a column-ordered map of column name to driver value. */
public final class MapListMaterializer implements Materializer<List<Map<String, Object>>> {
  @Override
  public DesiredColumns desiredColumns() {
    return DesiredColumns.all();
  }

  @Override
  public List<Map<String, Object>> fromRows(ExecutionToken source, RowCursor rows) {
    List<Map<String, Object>> out = new ArrayList<>();
    while (rows.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < rows.fieldCount(); i++) row.put(rows.name(i), rows.getObject(i));
      out.add(row);
    }
    return out;
  }
}
