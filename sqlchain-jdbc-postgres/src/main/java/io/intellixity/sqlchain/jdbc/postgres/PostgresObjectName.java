package io.intellixity.sqlchain.jdbc.postgres;

import io.intellixity.sqlchain.jdbc.dialect.QualifiedNames;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Schema-qualified PostgreSQL name. An unqualified name lives in {@value #DEFAULT_SCHEMA}. */
public record PostgresObjectName(String schema, String name) {
  public static final String DEFAULT_SCHEMA = "public";

  public PostgresObjectName {
    Objects.requireNonNull(name, "name");
    if (schema == null) schema = DEFAULT_SCHEMA;
  }

  public static PostgresObjectName parse(String text) {
    List<String> parts = QualifiedNames.split(text, '"', '"');
    return switch (parts.size()) {
      case 1 -> new PostgresObjectName(DEFAULT_SCHEMA, parts.get(0));
      case 2 -> new PostgresObjectName(parts.get(0), parts.get(1));
      default -> throw new IllegalArgumentException("Expected [schema.]name, got " + text);
    };
  }

  PostgresObjectName toLowerCase() {
    return new PostgresObjectName(schema.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return schema + "." + name;
  }
}
