package io.lacuna.scanpath.metrics;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.scanpath.RunTrace;
import io.lacuna.scanpath.StackEntry;
import org.apache.commons.lang3.Validate;

/**
 * Scores derived from a {@link RunTrace}.
 */
public final class Metrics {

  private Metrics() {
  }

  /**
   * @return the greatest number of open contexts at any point in the run
   */
  public static int maxStackDepth(RunTrace trace) {
    Validate.notNull(trace, "trace must not be null");
    return trace.maxDepth();
  }

  /**
   * The Verification Completeness Score: the fraction of opened contexts which were closed by a matching
   * verification event. A run which opens no contexts is vacuously complete.
   *
   * @return a score within {@code [0, 1]}
   */
  public static double vcs(RunTrace trace) {
    Validate.notNull(trace, "trace must not be null");
    long opened = trace.totalPushes();
    if (opened == 0) {
      return 1.0;
    }
    return Math.min(1.0, (double) trace.verifiedPops() / opened);
  }

  /**
   * @return the stack depth after each consumed symbol
   */
  public static IList<Integer> depthProfile(RunTrace trace) {
    Validate.notNull(trace, "trace must not be null");
    return trace.depths();
  }

  /**
   * @return the contexts still open when the run ended, outermost first
   */
  public static IList<StackEntry> openContexts(RunTrace trace) {
    Validate.notNull(trace, "trace must not be null");
    LinearList<StackEntry> open = new LinearList<>();
    for (StackEntry e : trace.last().stack()) {
      if (e.symbol().isContext()) {
        open.addLast(e);
      }
    }
    return open;
  }
}
