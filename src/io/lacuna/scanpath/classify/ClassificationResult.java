package io.lacuna.scanpath.classify;

import java.util.Locale;
import java.util.Objects;

/**
 * The classification of a single scanpath.
 */
public final class ClassificationResult {

  public enum Status {
    /** consumed completely, ending in the accepting state */
    ACCEPTED,
    /** consumed completely, but verification never finished */
    UNTERMINATED,
    /** stopped at a symbol for which there was no transition */
    DEAD_CONFIGURATION,
    /** contained a token outside the alphabet, and was not run */
    INVALID_SYMBOL
  }

  private final Status status;
  private final int maxStackDepth;
  private final double vcs;
  private final Label label;
  private final int stoppedAt;
  private final String token;
  private final String diagnostic;

  ClassificationResult(Status status, int maxStackDepth, double vcs, Label label, int stoppedAt, String token,
                       String diagnostic) {
    this.status = status;
    this.maxStackDepth = maxStackDepth;
    this.vcs = vcs;
    this.label = label;
    this.stoppedAt = stoppedAt;
    this.token = token;
    this.diagnostic = diagnostic;
  }

  public boolean accepted() {
    return status == Status.ACCEPTED;
  }

  public Status status() {
    return status;
  }

  public int maxStackDepth() {
    return maxStackDepth;
  }

  public double vcs() {
    return vcs;
  }

  public Label label() {
    return label;
  }

  /**
   * @return the index of the symbol processing stopped at, or {@code -1} if the whole sequence was consumed
   */
  public int stoppedAt() {
    return stoppedAt;
  }

  /**
   * @return the token processing stopped at, or {@code null} if the whole sequence was consumed
   */
  public String token() {
    return token;
  }

  /**
   * @return a description of why processing stopped, or {@code null} if the whole sequence was consumed
   */
  public String diagnostic() {
    return diagnostic;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClassificationResult)) {
      return false;
    }
    ClassificationResult r = (ClassificationResult) o;
    return status == r.status
            && maxStackDepth == r.maxStackDepth
            && Double.compare(vcs, r.vcs) == 0
            && label == r.label
            && stoppedAt == r.stoppedAt
            && Objects.equals(token, r.token)
            && Objects.equals(diagnostic, r.diagnostic);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, maxStackDepth, vcs, label, stoppedAt, token, diagnostic);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder()
            .append(label)
            .append(" accepted=").append(accepted())
            .append(" depth=").append(maxStackDepth)
            .append(String.format(Locale.ROOT, " vcs=%.2f", vcs))
            .append(" status=").append(status);
    if (diagnostic != null) {
      sb.append(" (").append(diagnostic).append(")");
    }
    return sb.toString();
  }
}
