package io.lacuna.scanpath.classify;

import io.lacuna.scanpath.Scanpath;
import io.lacuna.scanpath.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for labeling scanpaths.
 */
public class ClassifierTest {

  private final Classifier classifier = Classifier.create();

  @Test
  @DisplayName("Should label a fully verified read complete")
  void classify_CompleteRead_Complete() {
    final ClassificationResult r = classifier.classify("O R II P Q S T V1 P Q V II ✓ V1 ✓ O");

    assertThat(r.accepted()).isTrue();
    assertThat(r.status()).isEqualTo(ClassificationResult.Status.ACCEPTED);
    assertThat(r.label()).isEqualTo(Label.COMPLETE);
    assertThat(r.vcs()).isEqualTo(1.0);
    assertThat(r.maxStackDepth()).isEqualTo(4);
    assertThat(r.stoppedAt()).isEqualTo(-1);
    assertThat(r.token()).isNull();
    assertThat(r.diagnostic()).isNull();
  }

  @Test
  @DisplayName("Should label a read which never verified anything none")
  void classify_NoVerification_None() {
    final ClassificationResult r = classifier.classify("O R II P Q V1 P");

    assertThat(r.accepted()).isFalse();
    assertThat(r.status()).isEqualTo(ClassificationResult.Status.UNTERMINATED);
    assertThat(r.label()).isEqualTo(Label.NONE);
    assertThat(r.vcs()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should stop at a verification of the wrong lead")
  void classify_WrongLead_DeadConfiguration() {
    final ClassificationResult r = classifier.classify("O R II P V ✓ V1 ✓ O");

    assertThat(r.accepted()).isFalse();
    assertThat(r.status()).isEqualTo(ClassificationResult.Status.DEAD_CONFIGURATION);
    assertThat(r.stoppedAt()).isEqualTo(6);
    assertThat(r.token()).isEqualTo("V1");
    assertThat(r.diagnostic()).contains("Lm(II)");
    assertThat(r.label()).isEqualTo(Label.INCOMPLETE);
  }

  @Test
  @DisplayName("Should label partial unwinding incomplete")
  void classify_PartialUnwinding_Incomplete() {
    final ClassificationResult r = classifier.classify("O R II P V ✓");

    assertThat(r.label()).isEqualTo(Label.INCOMPLETE);
    assertThat(r.vcs()).isEqualTo(0.5);
    assertThat(r.status()).isEqualTo(ClassificationResult.Status.UNTERMINATED);
  }

  @Test
  @DisplayName("Should label the empty scanpath none, with a vacuous score")
  void classify_Empty_None() {
    for (ClassificationResult r : new ClassificationResult[]{classifier.classify(""), classifier.classify(Scanpath.EMPTY)}) {
      assertThat(r.accepted()).isFalse();
      assertThat(r.label()).isEqualTo(Label.NONE);
      assertThat(r.vcs()).isEqualTo(1.0);
      assertThat(r.maxStackDepth()).isZero();
    }
  }

  @Test
  @DisplayName("Should report unknown tokens without running the automaton")
  void classify_UnknownToken_InvalidSymbol() {
    final ClassificationResult r = classifier.classify("O R II X9 V II");

    assertThat(r.status()).isEqualTo(ClassificationResult.Status.INVALID_SYMBOL);
    assertThat(r.accepted()).isFalse();
    assertThat(r.stoppedAt()).isEqualTo(3);
    assertThat(r.token()).isEqualTo("X9");
    assertThat(r.maxStackDepth()).isZero();
    assertThat(r.vcs()).isEqualTo(1.0);
    assertThat(r.label()).isEqualTo(Label.NONE);
  }

  @ParameterizedTest
  @CsvSource({
          "O R II V O,                 complete",
          "O R II R V ✓ II,            complete",
          "O R,                        none",
          "O R II,                     none",
          "O R II P V,                 none",
          "O R II V1 V V1,             incomplete",
          "O R II P V1 P V ✓ V1 ✓,     incomplete",
          "O R II P V ✓ ✓,             complete",
          "O R II P V ✓ V1,            incomplete",
          "O R II P V ✓ R,             incomplete"
  })
  @DisplayName("Should label by acceptance and closed contexts")
  void classify_Table(String scanpath, String label) {
    assertThat(classifier.classify(scanpath).label().toString()).isEqualTo(label);
  }

  @Test
  @DisplayName("Should label the common expert and novice patterns")
  void classify_CommonPatterns_Labeled() {
    final ClassificationResult expert = classifier.classify("O R II P Q V ✓ ✓ O");
    assertThat(expert.accepted()).isTrue();
    assertThat(expert.label()).isEqualTo(Label.COMPLETE);
    assertThat(expert.maxStackDepth()).isEqualTo(2);
    assertThat(expert.vcs()).isEqualTo(1.0);

    final ClassificationResult noVerification = classifier.classify("O R II P Q");
    assertThat(noVerification.status()).isEqualTo(ClassificationResult.Status.UNTERMINATED);
    assertThat(noVerification.label()).isEqualTo(Label.NONE);
    assertThat(noVerification.maxStackDepth()).isEqualTo(2);

    final ClassificationResult partial = classifier.classify("O R II P Q V ✓");
    assertThat(partial.label()).isEqualTo(Label.INCOMPLETE);
    assertThat(partial.vcs()).isEqualTo(0.5);

    final ClassificationResult featuresOnly = classifier.classify("O R II P Q S T");
    assertThat(featuresOnly.label()).isEqualTo(Label.NONE);
    assertThat(featuresOnly.vcs()).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should expose raw scores independent of the label")
  void rawScores_MatchClassification() {
    final Scanpath s = Scanpath.parse("O R II P V1 P V ✓ V1");

    assertThat(classifier.accepts(s)).isFalse();
    assertThat(classifier.maxStackDepth(s)).isEqualTo(4);
    assertThat(classifier.vcs(s)).isEqualTo(0.5);
    assertThat(classifier.classify(s).vcs()).isEqualTo(classifier.vcs(s));
  }

  @Test
  @DisplayName("Should promote high-scoring unaccepted reads under a score threshold policy")
  void classify_ScoreThreshold_Promotes() {
    final Classifier lenient = new Classifier(classifier.automaton(), LabelPolicy.scoreThreshold(0.75));

    assertThat(lenient.classify("O R II P V1 P V ✓ V1 ✓").label()).isEqualTo(Label.COMPLETE);
    assertThat(lenient.classify("O R II P V ✓").label()).isEqualTo(Label.INCOMPLETE);
    assertThat(lenient.classify("O R II P Q V1 P").label()).isEqualTo(Label.NONE);
    assertThat(lenient.classify("O R").label()).isEqualTo(Label.NONE);
    assertThat(lenient.classify("O R II V O").label()).isEqualTo(Label.COMPLETE);
  }

  @Test
  @DisplayName("Should never promote a rejected read under a score threshold policy")
  void classify_ScoreThresholdRejected_NotPromoted() {
    final Classifier lenient = new Classifier(classifier.automaton(), LabelPolicy.scoreThreshold(0.75));

    final ClassificationResult r = lenient.classify("O R II P V1 P V ✓ V1 ✓ V1");

    assertThat(r.status()).isEqualTo(ClassificationResult.Status.DEAD_CONFIGURATION);
    assertThat(r.vcs()).isEqualTo(0.75);
    assertThat(r.label()).isEqualTo(Label.INCOMPLETE);
  }

  @Test
  @DisplayName("Should refuse thresholds outside (0, 1]")
  void scoreThreshold_OutOfRange_Throws() {
    assertThatThrownBy(() -> LabelPolicy.scoreThreshold(0.0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LabelPolicy.scoreThreshold(1.5)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should return identical results for repeated classification")
  void classify_Repeated_Deterministic() {
    for (Scanpath s : randomScanpaths(500, 42L)) {
      assertThat(classifier.classify(s)).isEqualTo(classifier.classify(s));
    }
  }

  @Test
  @DisplayName("Should only accept reads whose every opened context was verified")
  void classify_Accepted_ImpliesFullUnwinding() {
    final List<Scanpath> scanpaths = randomScanpaths(2000, 7L);
    scanpaths.add(Scanpath.parse("O R II P Q S T V1 P Q V II ✓ V1 ✓ O"));
    scanpaths.add(Scanpath.parse("O R II R V ✓ II"));
    scanpaths.add(Scanpath.parse("O R II V V ✓ II O"));

    for (Scanpath s : scanpaths) {
      final ClassificationResult r = classifier.classify(s);
      if (r.accepted()) {
        assertThat(r.vcs()).as(s.toString()).isEqualTo(1.0);
        assertThat(r.label()).isEqualTo(Label.COMPLETE);
      }
      assertThat(r.vcs()).isBetween(0.0, 1.0);
      assertThat(r.maxStackDepth()).isGreaterThanOrEqualTo(0);
    }
  }

  /**
   * Random scanpaths which start with a plausible prefix, so that a useful fraction get past the first symbols.
   */
  static List<Scanpath> randomScanpaths(int count, long seed) {
    final Random random = new Random(seed);
    final Symbol[] alphabet = Symbol.values();
    final List<Scanpath> scanpaths = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      final List<Symbol> symbols = new ArrayList<>();
      symbols.add(Symbol.OVERVIEW);
      symbols.add(Symbol.RHYTHM);
      final int len = random.nextInt(16);
      for (int j = 0; j < len; j++) {
        symbols.add(alphabet[random.nextInt(alphabet.length)]);
      }
      scanpaths.add(Scanpath.from(symbols));
    }
    return scanpaths;
  }
}
