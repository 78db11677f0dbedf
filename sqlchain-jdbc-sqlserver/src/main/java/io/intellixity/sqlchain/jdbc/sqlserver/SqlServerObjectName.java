package io.intellixity.sqlchain.jdbc.sqlserver;

import io.intellixity.sqlchain.jdbc.dialect.QualifiedNames;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Schema-qualified SQL Server name; the schema defaults to {@value #DEFAULT_SCHEMA}. */
public record SqlServerObjectName(String schema, String name) {
  public static final String DEFAULT_SCHEMA = "dbo";

  public SqlServerObjectName {
    Objects.requireNonNull(name, "name");
    if (schema == null) schema = DEFAULT_SCHEMA;
  }

  /** Accepts {@code name}, {@code schema.name} and bracketed parts such as {@code [dbo].[Order Lines]}. */
  public static SqlServerObjectName parse(String text) {
    List<String> parts = QualifiedNames.split(text, '[', ']');
    return switch (parts.size()) {
      case 1 -> new SqlServerObjectName(DEFAULT_SCHEMA, parts.get(0));
      case 2 -> new SqlServerObjectName(parts.get(0), parts.get(1));
      default -> throw new IllegalArgumentException("Expected [schema.]name, got " + text);
    };
  }

  SqlServerObjectName toLowerCase() {
    return new SqlServerObjectName(schema.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return schema + "." + name;
  }
}
