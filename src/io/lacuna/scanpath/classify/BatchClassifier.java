package io.lacuna.scanpath.classify;

import io.lacuna.bifurcan.*;
import io.lacuna.scanpath.Utils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Classifies many scanpaths at once. Scanpaths are independent and the {@link Classifier} is immutable, so a
 * batch is split across the common fork-join pool without coordination. A malformed scanpath produces an
 * {@link ClassificationResult.Status#INVALID_SYMBOL} result in its own slot and never affects the others, as
 * does a null entry.
 */
public final class BatchClassifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchClassifier.class);

  private final Classifier classifier;
  private final boolean parallel;

  public BatchClassifier(Classifier classifier, boolean parallel) {
    this.classifier = Validate.notNull(classifier, "classifier must not be null");
    this.parallel = parallel;
  }

  public static BatchClassifier create(ClassifierConfig config) {
    Validate.notNull(config, "config must not be null");
    return new BatchClassifier(Classifier.create(config), config.parallel());
  }

  /**
   * @return the results, in the same order as {@code scanpaths}
   */
  public IList<ClassificationResult> classifyAll(IList<String> scanpaths) {
    Validate.notNull(scanpaths, "scanpaths must not be null");

    int n = (int) scanpaths.size();
    IntStream indices = IntStream.range(0, n);
    if (parallel) {
      indices = indices.parallel();
    }

    ClassificationResult[] results = indices
            .mapToObj(i -> classify(i, scanpaths.nth(i)))
            .toArray(ClassificationResult[]::new);

    IList<ClassificationResult> list = LinearList.of(results);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("classified {} scanpaths: {}", n, summarize(list));
    }
    return list;
  }

  private ClassificationResult classify(int i, String scanpath) {
    if (scanpath == null) {
      LOGGER.debug("scanpath {} is null", i);
      return classifier.invalid(0, null, "scanpath " + i + " is null");
    }
    return classifier.classify(scanpath);
  }

  /**
   * @return the number of results with each label
   */
  public static IMap<Label, Long> summarize(IList<ClassificationResult> results) {
    Validate.notNull(results, "results must not be null");
    LinearMap<Label, Long> counts = new LinearMap<>();
    for (Label l : Label.values()) {
      counts.put(l, 0L);
    }
    results.forEach(r -> Utils.increment(counts, r.label()));
    return counts;
  }
}
