package io.intellixity.sqlchain.metadata;

/** Flags combined into the mask passed to {@link TableOrViewMetadata#getPropertiesFor}. */
public enum PropertiesFilter {
  /** Only primary key columns. */
  PRIMARY_KEY,
  /** Only columns outside the primary key. */
  NON_PRIMARY_KEY,
  /** Only properties annotated with {@code @Key}. */
  OBJECT_DEFINED_KEY,
  /** Only properties without {@code @Key}. */
  OBJECT_DEFINED_NON_KEY,
  /** Drop identity and computed columns. */
  UPDATABLE_ONLY,
  /** With {@link #PRIMARY_KEY}: every key column must have a property. */
  THROW_ON_MISSING_PROPERTIES,
  /** Every mapped property must have a column. */
  THROW_ON_MISSING_COLUMNS,
  /** An empty result is an error. */
  THROW_ON_NO_MATCH
}
