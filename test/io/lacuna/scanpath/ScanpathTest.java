package io.lacuna.scanpath;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for tokenizing scanpaths.
 */
public class ScanpathTest {

  @Test
  @DisplayName("Should parse every kind of token")
  void parse_AllKinds_ParsesInOrder() {
    final Scanpath s = Scanpath.parse("O R II P V ✓");

    assertThat(s.symbols().toList()).containsExactly(
            Symbol.OVERVIEW, Symbol.RHYTHM, Symbol.LEAD_II, Symbol.P_WAVE, Symbol.VERIFY, Symbol.CONFIRM);
    assertThat(s.toString()).isEqualTo("O R II P V ✓");
  }

  @Test
  @DisplayName("Should treat runs of whitespace as a single separator")
  void parse_IrregularWhitespace_Ignored() {
    assertThat(Scanpath.parse("  O\tR \n II  ")).isEqualTo(Scanpath.parse("O R II"));
  }

  @Test
  @DisplayName("Should accept the aVR/aVL/aVF spellings of the augmented leads")
  void parse_AugmentedLeadAliases_MapToSameSymbol() {
    assertThat(Scanpath.parse("aVR aVL aVF")).isEqualTo(Scanpath.parse("aR aL aF"));
    assertThat(Scanpath.parse("aVR").nth(0).token()).isEqualTo("aR");
  }

  @Test
  @DisplayName("Should parse blank text as the empty scanpath")
  void parse_Blank_Empty() {
    assertThat(Scanpath.parse("")).isSameAs(Scanpath.EMPTY);
    assertThat(Scanpath.parse("   ").isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should report the first unrecognized token and its index")
  void parse_UnknownToken_Throws() {
    assertThatThrownBy(() -> Scanpath.parse("O R II X9 V ??"))
            .isInstanceOf(InvalidSymbolException.class)
            .hasMessageContaining("X9")
            .satisfies(e -> {
              InvalidSymbolException ise = (InvalidSymbolException) e;
              assertThat(ise.token()).isEqualTo("X9");
              assertThat(ise.index()).isEqualTo(3);
            });
  }

  @Test
  @DisplayName("Should be case sensitive, so lowercase tokens are rejected")
  void parse_Lowercase_Throws() {
    assertThatThrownBy(() -> Scanpath.parse("o"))
            .isInstanceOf(InvalidSymbolException.class);
  }

  @Test
  @DisplayName("Should group the alphabet by kind")
  void ofKind_Leads_TwelveStandardLeads() {
    assertThat(Symbol.ofKind(Symbol.Kind.LEAD).toList())
            .hasSize(12)
            .allMatch(s -> s.is(Symbol.Kind.LEAD))
            .startsWith(Symbol.LEAD_I, Symbol.LEAD_II, Symbol.LEAD_III);
    assertThat(Symbol.ofKind(Symbol.Kind.FEATURE).toList())
            .containsExactly(Symbol.P_WAVE, Symbol.Q_WAVE, Symbol.S_WAVE, Symbol.T_WAVE);
  }
}
