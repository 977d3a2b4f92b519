package io.lacuna.scanpath;

/**
 * Describes where and why a run reached a dead configuration.
 */
public final class Rejection {

  public enum Reason {
    /** no rule matches the current state, input, and stack top */
    DEAD_CONFIGURATION,
    /** a lead verification does not match the lead context on top of the stack */
    MISMATCHED_VERIFICATION
  }

  private final Reason reason;
  private final int index;
  private final Symbol symbol;
  private final Configuration configuration;

  Rejection(Reason reason, int index, Symbol symbol, Configuration configuration) {
    this.reason = reason;
    this.index = index;
    this.symbol = symbol;
    this.configuration = configuration;
  }

  public Reason reason() {
    return reason;
  }

  /**
   * @return the index of the symbol which could not be consumed
   */
  public int index() {
    return index;
  }

  public Symbol symbol() {
    return symbol;
  }

  /**
   * @return the configuration the symbol was read in
   */
  public Configuration configuration() {
    return configuration;
  }

  @Override
  public String toString() {
    if (reason == Reason.MISMATCHED_VERIFICATION) {
      return "'" + symbol + "' at index " + index + " verifies a lead other than the open "
              + configuration.top();
    }
    return "no transition for '" + symbol + "' at index " + index + " in " + configuration;
  }
}
