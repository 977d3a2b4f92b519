package io.lacuna.scanpath;

import java.util.Objects;

/**
 * A single stack cell: the context kind, and the symbol which opened it.
 */
public final class StackEntry {

  public static final StackEntry BOTTOM = new StackEntry(StackSymbol.Z0, null);

  private final StackSymbol symbol;
  private final Symbol opener;

  private StackEntry(StackSymbol symbol, Symbol opener) {
    this.symbol = symbol;
    this.opener = opener;
  }

  /**
   * @return an entry for a context of kind {@code symbol}, opened by the input {@code opener}
   */
  public static StackEntry of(StackSymbol symbol, Symbol opener) {
    if (symbol == StackSymbol.Z0) {
      throw new IllegalArgumentException("Z0 is only valid as the bottom of the stack");
    }
    return new StackEntry(symbol, Objects.requireNonNull(opener, "opener must not be null"));
  }

  public StackSymbol symbol() {
    return symbol;
  }

  /**
   * @return the input symbol that opened this context, or {@code null} for {@link #BOTTOM}
   */
  public Symbol opener() {
    return opener;
  }

  /**
   * @return true if consuming {@code verification} may close this context
   */
  public boolean matches(Symbol verification) {
    if (symbol == StackSymbol.Lm && verification.is(Symbol.Kind.LEAD)) {
      return opener == verification;
    }
    return symbol != StackSymbol.Z0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StackEntry)) {
      return false;
    }
    StackEntry e = (StackEntry) o;
    return symbol == e.symbol && opener == e.opener;
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, opener);
  }

  @Override
  public String toString() {
    return opener == null ? symbol.name() : symbol.name() + "(" + opener + ")";
  }
}
