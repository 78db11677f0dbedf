package io.intellixity.sqlchain.spi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A ready-to-run statement with its parameters and post-conditions, optionally followed by further tokens.\n
 *
 * Immutable. At most one token of a chain returns rows; row-count expectations apply to the others.
 */
public final class ExecutionToken {
  private final String operation;
  private final String commandText;
  private final CommandType commandType;
  private final List<CommandParameter> parameters;
  private final boolean returnsRows;
  private final Integer expectedRowCount;
  private final LockMode lockMode;
  private final Duration timeout;
  private final ExecutionToken next;

  public ExecutionToken(String operation, String commandText, CommandType commandType, List<CommandParameter> parameters,
                        boolean returnsRows, Integer expectedRowCount, LockMode lockMode, Duration timeout,
                        ExecutionToken next) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.commandText = Objects.requireNonNull(commandText, "commandText");
    this.commandType = (commandType == null) ? CommandType.TEXT : commandType;
    this.parameters = List.copyOf(parameters);
    this.returnsRows = returnsRows;
    this.expectedRowCount = expectedRowCount;
    this.lockMode = (lockMode == null) ? LockMode.NONE : lockMode;
    this.timeout = timeout;
    this.next = next;
  }

  public static ExecutionToken query(String operation, String commandText, List<CommandParameter> parameters) {
    return new ExecutionToken(operation, commandText, CommandType.TEXT, parameters, true, null, LockMode.READ, null, null);
  }

  public static ExecutionToken nonQuery(String operation, String commandText, List<CommandParameter> parameters) {
    return new ExecutionToken(operation, commandText, CommandType.TEXT, parameters, false, null, LockMode.WRITE, null, null);
  }

  public String operation() { return operation; }
  public String commandText() { return commandText; }
  public CommandType commandType() { return commandType; }
  public List<CommandParameter> parameters() { return parameters; }
  public boolean returnsRows() { return returnsRows; }
  public Integer expectedRowCount() { return expectedRowCount; }
  public LockMode lockMode() { return lockMode; }
  public Duration timeout() { return timeout; }
  public ExecutionToken next() { return next; }

  public ExecutionToken withExpectedRowCount(Integer expected) {
    return new ExecutionToken(operation, commandText, commandType, parameters, returnsRows, expected, lockMode, timeout, next);
  }

  public ExecutionToken withLockMode(LockMode mode) {
    return new ExecutionToken(operation, commandText, commandType, parameters, returnsRows, expectedRowCount, mode, timeout, next);
  }

  public ExecutionToken withTimeout(Duration timeout) {
    return new ExecutionToken(operation, commandText, commandType, parameters, returnsRows, expectedRowCount, lockMode, timeout, next);
  }

  /** A copy of this chain with {@code last} appended after its final token. */
  public ExecutionToken withNext(ExecutionToken last) {
    Objects.requireNonNull(last, "last");
    ExecutionToken tail = (next == null) ? last : next.withNext(last);
    return new ExecutionToken(operation, commandText, commandType, parameters, returnsRows, expectedRowCount, lockMode, timeout, tail);
  }

  /** Tokens of this chain in execution order. */
  public List<ExecutionToken> chain() {
    List<ExecutionToken> out = new ArrayList<>();
    for (ExecutionToken t = this; t != null; t = t.next) out.add(t);
    return out;
  }

  /** Strongest lock mode of the chain. */
  public LockMode chainLockMode() {
    LockMode m = LockMode.NONE;
    for (ExecutionToken t = this; t != null; t = t.next) m = m.max(t.lockMode);
    return m;
  }

  public boolean chainReturnsRows() {
    for (ExecutionToken t = this; t != null; t = t.next) if (t.returnsRows) return true;
    return false;
  }

  /** Throws {@link RowCountMismatchException} when an expectation is set and {@code actual} differs. */
  public void checkAffectedRowCount(Integer actual) {
    if (expectedRowCount == null) return;
    if (actual == null || actual.intValue() != expectedRowCount) {
      throw new RowCountMismatchException(expectedRowCount, actual, commandText);
    }
  }

  @Override
  public String toString() {
    return "ExecutionToken[" + operation + ": " + commandText + (next == null ? "" : " -> " + next) + "]";
  }
}
