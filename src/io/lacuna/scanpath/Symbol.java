package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * The terminal alphabet: the discrete events a symbolized ECG scanpath is made of.
 */
public enum Symbol {

  OVERVIEW("O", Kind.OVERVIEW),
  RHYTHM("R", Kind.RHYTHM),

  LEAD_I("I", Kind.LEAD),
  LEAD_II("II", Kind.LEAD),
  LEAD_III("III", Kind.LEAD),
  LEAD_AVR("aR", Kind.LEAD, "aVR"),
  LEAD_AVL("aL", Kind.LEAD, "aVL"),
  LEAD_AVF("aF", Kind.LEAD, "aVF"),
  LEAD_V1("V1", Kind.LEAD),
  LEAD_V2("V2", Kind.LEAD),
  LEAD_V3("V3", Kind.LEAD),
  LEAD_V4("V4", Kind.LEAD),
  LEAD_V5("V5", Kind.LEAD),
  LEAD_V6("V6", Kind.LEAD),

  P_WAVE("P", Kind.FEATURE),
  Q_WAVE("Q", Kind.FEATURE),
  S_WAVE("S", Kind.FEATURE),
  T_WAVE("T", Kind.FEATURE),

  VERIFY("V", Kind.VERIFY),
  CONFIRM("✓", Kind.CONFIRM);

  /**
   * The role a symbol plays in the diagnostic workflow.
   */
  public enum Kind {
    OVERVIEW,
    RHYTHM,
    LEAD,
    FEATURE,
    /** opens the verification phase */
    VERIFY,
    /** confirms the innermost open context */
    CONFIRM
  }

  private static final IMap<String, Symbol> BY_TOKEN;
  private static final IMap<Kind, ISet<Symbol>> BY_KIND;

  static {
    BY_KIND = Utils.groupBy(LinearList.of(values()), Symbol::kind).forked();

    LinearMap<String, Symbol> m = new LinearMap<>();
    for (Symbol s : values()) {
      m.put(s.token, s);
      if (s.alias != null) {
        m.put(s.alias, s);
      }
    }
    BY_TOKEN = m.forked();
  }

  private final String token;
  private final String alias;
  private final Kind kind;

  Symbol(String token, Kind kind) {
    this(token, kind, null);
  }

  Symbol(String token, Kind kind, String alias) {
    this.token = token;
    this.kind = kind;
    this.alias = alias;
  }

  /**
   * @return the canonical textual token, e.g. {@code "V1"} or {@code "✓"}
   */
  public String token() {
    return token;
  }

  public Kind kind() {
    return kind;
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  /**
   * @return the symbol for {@code token}, accepting the {@code aVR/aVL/aVF} spellings of the augmented leads
   */
  public static Optional<Symbol> fromToken(String token) {
    return BY_TOKEN.get(token);
  }

  /**
   * @return every symbol of the given kind, in declaration order
   */
  public static IList<Symbol> ofKind(Kind kind) {
    return BY_KIND.get(kind)
            .map(ISet::elements)
            .orElseGet(LinearList::new);
  }

  @Override
  public String toString() {
    return token;
  }
}
