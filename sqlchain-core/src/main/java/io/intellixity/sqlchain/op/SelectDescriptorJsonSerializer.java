package io.intellixity.sqlchain.op;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Canonical JSON form of {@link SelectDescriptor}:\n
 *
 * <pre>
 * {"table":"dbo.Customer",
 *  "filter":{"where":"Name = :name","args":{"name":"x"}},
 *  "sort":[{"column":"Name","dir":"DESC"}],
 *  "limits":{"skip":0,"take":10,"options":"ROWS"}}
 * </pre>
 *
 * Value filters are written as {@code {"value":{...},"options":"NONE"}}; object filter values are written as beans.
 */
public final class SelectDescriptorJsonSerializer extends JsonSerializer<SelectDescriptor> {
  @Override
  public void serialize(SelectDescriptor d, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (d == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("table", d.tableName());

    TableFilter f = d.filter();
    if (f instanceof WhereClauseFilter w) {
      g.writeObjectFieldStart("filter");
      g.writeStringField("where", w.whereClause());
      if (w.argumentValue() != null) g.writeObjectField("args", w.argumentValue());
      g.writeEndObject();
    } else if (f instanceof ValueFilter v) {
      g.writeObjectFieldStart("filter");
      g.writeObjectField("value", v.filterValue());
      g.writeStringField("options", v.options().name());
      g.writeEndObject();
    }

    if (!d.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortExpression s : d.sort()) {
        g.writeStartObject();
        g.writeStringField("column", s.columnName());
        g.writeStringField("dir", s.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    Limits l = d.limits();
    if (!l.isNone()) {
      g.writeObjectFieldStart("limits");
      if (l.skip() != null) g.writeNumberField("skip", l.skip());
      if (l.take() != null) g.writeNumberField("take", l.take());
      g.writeStringField("options", l.options().name());
      if (l.seed() != null) g.writeNumberField("seed", l.seed());
      g.writeEndObject();
    }

    g.writeEndObject();
  }
}
