package io.intellixity.sqlchain.op;

import java.util.Objects;

/** Insert one row from the readable properties of {@code argumentValue}. */
public record InsertDescriptor(String tableName, Object argumentValue) {
  public InsertDescriptor {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(argumentValue, "argumentValue");
  }
}
