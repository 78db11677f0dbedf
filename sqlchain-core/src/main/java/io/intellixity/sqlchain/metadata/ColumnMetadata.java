package io.intellixity.sqlchain.metadata;

import java.util.Objects;

/**
 * One column of a table or view, as discovered from the database catalog.
 *
 * @param sqlName       column name as the database reports it
 * @param quotedSqlName name quoted for the owning dialect
 * @param clrName       property-facing name (identifier characters only)
 * @param typeName      native type tag, e.g. {@code int}, {@code nvarchar}, {@code TEXT}; may be null
 */
public record ColumnMetadata(
    String sqlName,
    String quotedSqlName,
    String clrName,
    String typeName,
    boolean primaryKey,
    boolean identity,
    boolean computed,
    boolean nullable
) {
  public ColumnMetadata {
    Objects.requireNonNull(sqlName, "sqlName");
    Objects.requireNonNull(quotedSqlName, "quotedSqlName");
    if (sqlName.isBlank()) throw new IllegalArgumentException("sqlName is blank");
    if (clrName == null) clrName = clrNameOf(sqlName);
  }

  public ColumnMetadata(String sqlName, String quotedSqlName, String typeName,
                        boolean primaryKey, boolean identity, boolean computed, boolean nullable) {
    this(sqlName, quotedSqlName, null, typeName, primaryKey, identity, computed, nullable);
  }

  /** Identity and computed columns are written by the database, never by callers. */
  public boolean updatable() {
    return !identity && !computed;
  }

  static String clrNameOf(String sqlName) {
    StringBuilder sb = new StringBuilder(sqlName.length());
    for (int i = 0; i < sqlName.length(); i++) {
      char c = sqlName.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_') sb.append(c);
    }
    return sb.toString();
  }
}
