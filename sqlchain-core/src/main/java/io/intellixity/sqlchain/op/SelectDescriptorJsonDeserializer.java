package io.intellixity.sqlchain.op;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Reads the form written by {@link SelectDescriptorJsonSerializer}. Filter values come back as Maps. */
public final class SelectDescriptorJsonDeserializer extends JsonDeserializer<SelectDescriptor> {
  @Override
  public SelectDescriptor deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("SelectDescriptor JSON must be an object");

    String table = textOrNull(root.get("table"));
    if (table == null) throw new IllegalArgumentException("SelectDescriptor JSON requires 'table'");
    SelectDescriptor d = SelectDescriptor.from(table);

    JsonNode filter = root.get("filter");
    if (filter != null && filter.isObject()) {
      String where = textOrNull(filter.get("where"));
      if (where != null) {
        JsonNode args = filter.get("args");
        d = d.withFilter(where, (args == null || args.isNull()) ? null : codec.treeToValue(args, Map.class));
      } else {
        JsonNode value = filter.get("value");
        if (value == null || !value.isObject()) {
          throw new IllegalArgumentException("Filter JSON requires 'where' or an object 'value'");
        }
        String opts = textOrNull(filter.get("options"));
        d = d.withFilter(codec.treeToValue(value, Map.class),
            opts == null ? FilterOptions.NONE : FilterOptions.valueOf(opts.toUpperCase(Locale.ROOT)));
      }
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortExpression> out = new ArrayList<>();
      for (JsonNode s : sort) {
        String column = textOrNull(s.get("column"));
        if (column == null) continue;
        String dir = textOrNull(s.get("dir"));
        out.add(new SortExpression(column,
            dir == null ? SortExpression.Direction.ASC : SortExpression.Direction.valueOf(dir.toUpperCase(Locale.ROOT))));
      }
      d = d.withSorting(out);
    }

    JsonNode limits = root.get("limits");
    if (limits != null && limits.isObject()) {
      String opts = textOrNull(limits.get("options"));
      d = d.withLimits(intOrNull(limits.get("skip")), intOrNull(limits.get("take")),
          opts == null ? LimitOptions.NONE : LimitOptions.valueOf(opts.toUpperCase(Locale.ROOT)),
          intOrNull(limits.get("seed")));
    }
    return d;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asInt();
  }
}
