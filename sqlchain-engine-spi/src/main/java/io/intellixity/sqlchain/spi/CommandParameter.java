package io.intellixity.sqlchain.spi;

import java.util.Objects;

/**
 * A bound parameter.
 *
 * @param name    logical name, used for logging and named-parameter drivers
 * @param value   bound value, may be null
 * @param sqlType {@link java.sql.Types} code when the value alone does not determine it, else null
 */
public record CommandParameter(String name, Object value, Integer sqlType) {
  public CommandParameter {
    Objects.requireNonNull(name, "name");
  }

  public CommandParameter(String name, Object value) {
    this(name, value, null);
  }
}
