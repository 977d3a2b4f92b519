package io.lacuna.scanpath;

/**
 * The phases of the diagnostic workflow. {@link #q0} is initial, {@link #q6} is the only accepting state.
 */
public enum State {

  q0("awaiting overview"),
  q1("overview done"),
  q2("rhythm assessment"),
  q3("lead examination"),
  q4("feature examination"),
  q5("verification"),
  q6("complete");

  public static final State INITIAL = q0;

  private final String phase;

  State(String phase) {
    this.phase = phase;
  }

  /**
   * @return a short description of the workflow phase this state represents
   */
  public String phase() {
    return phase;
  }

  public boolean isAccepting() {
    return this == q6;
  }
}
