package io.lacuna.scanpath.classify;

import io.lacuna.scanpath.RunTrace;
import org.apache.commons.lang3.Validate;

/**
 * Maps a run, and its Verification Completeness Score, to a {@link Label}.
 */
public interface LabelPolicy {

  Label label(RunTrace trace, double vcs);

  /**
   * Accepted runs are {@link Label#COMPLETE}, runs which closed no context are {@link Label#NONE}, and all
   * others are {@link Label#INCOMPLETE}.
   */
  static LabelPolicy acceptance() {
    return (trace, vcs) -> {
      if (trace.accepted()) {
        return Label.COMPLETE;
      }
      return trace.verifiedPops() == 0 ? Label.NONE : Label.INCOMPLETE;
    };
  }

  /**
   * Like {@link #acceptance()}, but also labels an unterminated run as {@link Label#COMPLETE} if it opened at
   * least one context and its score is at least {@code completeAt}. Rejected runs are never promoted.
   */
  static LabelPolicy scoreThreshold(double completeAt) {
    Validate.inclusiveBetween(0.0, 1.0, completeAt, "completeAt must be within [0, 1]");
    Validate.isTrue(completeAt > 0.0, "completeAt must be positive");

    LabelPolicy base = acceptance();
    return (trace, vcs) -> {
      if (trace.outcome() == RunTrace.Outcome.UNTERMINATED && trace.totalPushes() > 0 && vcs >= completeAt) {
        return Label.COMPLETE;
      }
      return base.label(trace, vcs);
    };
  }
}
