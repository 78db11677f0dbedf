package io.intellixity.sqlchain.metadata;

/** A stored procedure parameter. {@code clrName} drops the leading marker, e.g. {@code @Id} becomes {@code Id}. */
public record ParameterMetadata(String sqlParameterName, String clrName, String typeName, boolean output) {
  public ParameterMetadata(String sqlParameterName, String typeName, boolean output) {
    this(sqlParameterName, ColumnMetadata.clrNameOf(sqlParameterName), typeName, output);
  }
}
