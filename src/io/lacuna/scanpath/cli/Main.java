package io.lacuna.scanpath.cli;

import io.lacuna.bifurcan.*;
import io.lacuna.scanpath.classify.BatchClassifier;
import io.lacuna.scanpath.classify.ClassificationResult;
import io.lacuna.scanpath.classify.ClassifierConfig;
import io.lacuna.scanpath.classify.Label;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Classifies scanpaths given as arguments, or one per line on stdin, and prints one tab-separated line per
 * scanpath: label, accepted, max stack depth, score, and the scanpath itself.
 *
 * <pre>
 *   java io.lacuna.scanpath.cli.Main "O R II P Q V ✓ II O" "O R II P"
 *   java io.lacuna.scanpath.cli.Main --demo
 * </pre>
 */
public final class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  static final IList<String> DEMO = LinearList.of(
          "O R II P Q S T V1 P Q V II ✓ V1 ✓ O",
          "O R II P Q V1 P",
          "O R II P V ✓",
          "O R II P V ✓ V1",
          "O R II V1 aVF V aVF V1 II O",
          "O R II P Q V ✓ ✓ O",
          "O R II P Q",
          "O R II P Q V ✓",
          "O R II P Q S T");

  private Main() {
  }

  public static void main(String[] args) throws IOException {
    BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    PrintStream out = new PrintStream(System.out, true, "UTF-8");
    System.exit(run(args, in, out));
  }

  /**
   * @return the process exit code
   */
  static int run(String[] args, BufferedReader in, PrintStream out) throws IOException {
    IList<String> scanpaths;
    if (args.length == 1 && args[0].equals("--demo")) {
      scanpaths = DEMO;
    } else if (args.length > 0) {
      for (String arg : args) {
        if (arg.startsWith("--")) {
          out.println("unknown option " + arg);
          out.println("usage: Main [--demo | scanpath...]");
          return 2;
        }
      }
      scanpaths = LinearList.of(args);
    } else {
      LinearList<String> lines = new LinearList<>();
      String line;
      while ((line = in.readLine()) != null) {
        if (!line.trim().isEmpty()) {
          lines.addLast(line);
        }
      }
      scanpaths = lines;
    }

    ClassifierConfig config = ClassifierConfig.load();
    LOGGER.info("classifying {} scanpaths with {}", scanpaths.size(), config);

    IList<ClassificationResult> results = BatchClassifier.create(config).classifyAll(scanpaths);
    for (int i = 0; i < results.size(); i++) {
      out.println(format(results.nth(i), scanpaths.nth(i)));
    }

    IMap<Label, Long> summary = BatchClassifier.summarize(results);
    LOGGER.info("complete={} incomplete={} none={}",
            summary.get(Label.COMPLETE, 0L), summary.get(Label.INCOMPLETE, 0L), summary.get(Label.NONE, 0L));

    return 0;
  }

  static String format(ClassificationResult r, String scanpath) {
    StringBuilder sb = new StringBuilder()
            .append(r.label()).append('\t')
            .append(r.accepted()).append('\t')
            .append(r.maxStackDepth()).append('\t')
            .append(String.format(Locale.ROOT, "%.2f", r.vcs())).append('\t')
            .append(scanpath.trim());
    if (r.diagnostic() != null) {
      sb.append('\t').append(r.diagnostic());
    }
    return sb.toString();
  }
}
