package io.lacuna.scanpath.classify;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.OptionalDouble;
import java.util.Properties;

/**
 * Classifier configuration values.
 *
 * <p>Read from the {@code scanpath.properties} classpath resource when present:
 * <ul>
 * <li>{@code scanpath.label.complete-threshold}: the score at or above which a run that was not accepted is still
 * labeled complete; unset means only accepted runs are complete</li>
 * <li>{@code scanpath.batch.parallel}: whether batches are classified in parallel, defaults to {@code true}</li>
 * </ul>
 */
public final class ClassifierConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClassifierConfig.class);

  public static final String RESOURCE = "scanpath.properties";
  public static final String COMPLETE_THRESHOLD = "scanpath.label.complete-threshold";
  public static final String PARALLEL = "scanpath.batch.parallel";

  private static final ClassifierConfig DEFAULTS = new ClassifierConfig(OptionalDouble.empty(), true);

  private final OptionalDouble completeThreshold;
  private final boolean parallel;

  public ClassifierConfig(OptionalDouble completeThreshold, boolean parallel) {
    Validate.notNull(completeThreshold, "completeThreshold must not be null");
    completeThreshold.ifPresent(t ->
            Validate.isTrue(t > 0.0 && t <= 1.0, "complete threshold must be within (0, 1], was %s", t));
    this.completeThreshold = completeThreshold;
    this.parallel = parallel;
  }

  public static ClassifierConfig defaults() {
    return DEFAULTS;
  }

  /**
   * @return the configuration in the {@code scanpath.properties} classpath resource, or the defaults if there is
   * no such resource
   */
  public static ClassifierConfig load() {
    return load(ClassifierConfig.class.getClassLoader(), RESOURCE);
  }

  static ClassifierConfig load(ClassLoader loader, String resource) {
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        LOGGER.debug("no {} on the classpath, using defaults", resource);
        return DEFAULTS;
      }
      Properties props = new Properties();
      props.load(in);
      LOGGER.debug("loaded classifier configuration from {}", resource);
      return fromProperties(props);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read " + resource, e);
    }
  }

  /**
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static ClassifierConfig fromProperties(Properties props) {
    Validate.notNull(props, "props must not be null");

    OptionalDouble threshold = OptionalDouble.empty();
    String t = props.getProperty(COMPLETE_THRESHOLD);
    if (t != null && !t.trim().isEmpty()) {
      try {
        threshold = OptionalDouble.of(Double.parseDouble(t.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(COMPLETE_THRESHOLD + " is not a number: '" + t + "'", e);
      }
    }

    String p = props.getProperty(PARALLEL);
    boolean parallel = p == null || p.trim().isEmpty() || parseBoolean(PARALLEL, p.trim());

    return new ClassifierConfig(threshold, parallel);
  }

  private static boolean parseBoolean(String key, String value) {
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false, was '" + value + "'");
  }

  public OptionalDouble completeThreshold() {
    return completeThreshold;
  }

  public boolean parallel() {
    return parallel;
  }

  public LabelPolicy labelPolicy() {
    return completeThreshold.isPresent()
            ? LabelPolicy.scoreThreshold(completeThreshold.getAsDouble())
            : LabelPolicy.acceptance();
  }

  @Override
  public String toString() {
    return "ClassifierConfig[completeThreshold=" + completeThreshold + ", parallel=" + parallel + "]";
  }
}
