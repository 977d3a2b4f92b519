package io.lacuna.scanpath.classify;

import io.lacuna.scanpath.*;
import io.lacuna.scanpath.metrics.Metrics;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels scanpaths as showing complete, incomplete, or no verification. Classification is a pure function of
 * the input; instances are immutable and may be shared between threads.
 */
public final class Classifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(Classifier.class);

  private final Automaton automaton;
  private final LabelPolicy policy;

  public Classifier(Automaton automaton, LabelPolicy policy) {
    this.automaton = Validate.notNull(automaton, "automaton must not be null");
    this.policy = Validate.notNull(policy, "policy must not be null");
  }

  /**
   * @return a classifier over the ECG workflow, labeling by acceptance
   */
  public static Classifier create() {
    return new Classifier(Automaton.ecgWorkflow(), LabelPolicy.acceptance());
  }

  public static Classifier create(ClassifierConfig config) {
    Validate.notNull(config, "config must not be null");
    return new Classifier(Automaton.ecgWorkflow(), config.labelPolicy());
  }

  public Automaton automaton() {
    return automaton;
  }

  public ClassificationResult classify(Scanpath scanpath) {
    RunTrace trace = automaton.run(scanpath);
    double vcs = Metrics.vcs(trace);
    Label label = policy.label(trace, vcs);

    switch (trace.outcome()) {
      case ACCEPTED:
        return new ClassificationResult(ClassificationResult.Status.ACCEPTED,
                Metrics.maxStackDepth(trace), vcs, label, -1, null, null);
      case UNTERMINATED:
        return new ClassificationResult(ClassificationResult.Status.UNTERMINATED,
                Metrics.maxStackDepth(trace), vcs, label, -1, null, null);
      default:
        Rejection r = trace.rejection().get();
        return new ClassificationResult(ClassificationResult.Status.DEAD_CONFIGURATION,
                Metrics.maxStackDepth(trace), vcs, label, r.index(), r.symbol().token(), r.toString());
    }
  }

  /**
   * Parses and classifies a whitespace-separated scanpath. A token outside the alphabet yields a result with
   * {@link ClassificationResult.Status#INVALID_SYMBOL}, scored as if no input had been read.
   */
  public ClassificationResult classify(String scanpath) {
    Validate.notNull(scanpath, "scanpath must not be null");

    Scanpath parsed;
    try {
      parsed = Scanpath.parse(scanpath);
    } catch (InvalidSymbolException e) {
      LOGGER.debug("not classifying '{}': {}", scanpath, e.getMessage());
      return invalid(e.index(), e.token(), e.getMessage());
    }
    return classify(parsed);
  }

  /**
   * @return an {@link ClassificationResult.Status#INVALID_SYMBOL} result, scored as if no input had been read
   */
  ClassificationResult invalid(int index, String token, String diagnostic) {
    RunTrace empty = automaton.run(Scanpath.EMPTY);
    double vcs = Metrics.vcs(empty);
    return new ClassificationResult(ClassificationResult.Status.INVALID_SYMBOL,
            Metrics.maxStackDepth(empty), vcs, policy.label(empty, vcs), index, token, diagnostic);
  }

  /// raw scores

  public boolean accepts(Scanpath scanpath) {
    return automaton.accepts(scanpath);
  }

  public int maxStackDepth(Scanpath scanpath) {
    return Metrics.maxStackDepth(automaton.run(scanpath));
  }

  public double vcs(Scanpath scanpath) {
    return Metrics.vcs(automaton.run(scanpath));
  }
}
