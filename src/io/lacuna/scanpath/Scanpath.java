package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;
import org.apache.commons.lang3.Validate;

import java.util.Iterator;
import java.util.stream.Collectors;

/**
 * An immutable sequence of symbols, representing one interpretation session.
 */
public final class Scanpath implements Iterable<Symbol> {

  public static final Scanpath EMPTY = new Scanpath(new List<>());

  private final IList<Symbol> symbols;

  private Scanpath(IList<Symbol> symbols) {
    this.symbols = symbols;
  }

  public static Scanpath of(Symbol... symbols) {
    return from(LinearList.of(symbols));
  }

  public static Scanpath from(Iterable<Symbol> symbols) {
    Validate.notNull(symbols, "symbols must not be null");
    LinearList<Symbol> list = new LinearList<>();
    for (Symbol s : symbols) {
      list.addLast(Validate.notNull(s, "symbols must not contain null"));
    }
    return new Scanpath(list.forked());
  }

  /**
   * Parses a whitespace-separated list of tokens, such as {@code "O R II P Q V II ✓ O"}.
   *
   * @throws InvalidSymbolException at the first token which is not part of the alphabet, in which case nothing
   *                                is parsed
   */
  public static Scanpath parse(String text) {
    Validate.notNull(text, "text must not be null");
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return EMPTY;
    }
    return parse(LinearList.of(trimmed.split("\\s+")));
  }

  /**
   * @throws InvalidSymbolException at the first token which is not part of the alphabet
   */
  public static Scanpath parse(IList<String> tokens) {
    Validate.notNull(tokens, "tokens must not be null");
    LinearList<Symbol> list = new LinearList<>();
    int idx = 0;
    for (String token : tokens) {
      final int i = idx++;
      list.addLast(Symbol.fromToken(token).orElseThrow(() -> new InvalidSymbolException(token, i)));
    }
    return new Scanpath(list.forked());
  }

  public int size() {
    return (int) symbols.size();
  }

  public boolean isEmpty() {
    return symbols.size() == 0;
  }

  public Symbol nth(int idx) {
    return symbols.nth(idx);
  }

  public IList<Symbol> symbols() {
    return symbols;
  }

  @Override
  public Iterator<Symbol> iterator() {
    return symbols.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Scanpath && symbols.equals(((Scanpath) o).symbols);
  }

  @Override
  public int hashCode() {
    return symbols.hashCode();
  }

  @Override
  public String toString() {
    return symbols.stream().map(Symbol::token).collect(Collectors.joining(" "));
  }
}
