package io.intellixity.sqlchain.spi;

import java.time.Duration;
import java.util.List;

/** Creates native commands over the connection(s) owned by a data source or transaction. */
@FunctionalInterface
public interface NativeCommandFactory {
  NativeCommand create(String commandText, CommandType commandType, List<CommandParameter> parameters, Duration timeout);
}
