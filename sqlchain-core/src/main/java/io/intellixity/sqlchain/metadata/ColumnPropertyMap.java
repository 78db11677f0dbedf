package io.intellixity.sqlchain.metadata;

import io.intellixity.sqlchain.reflect.PropertyMetadata;

import java.util.Objects;

/** A column paired with the property that supplies or receives its value. */
public record ColumnPropertyMap(ColumnMetadata column, PropertyMetadata property) {
  public ColumnPropertyMap {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(property, "property");
  }
}
