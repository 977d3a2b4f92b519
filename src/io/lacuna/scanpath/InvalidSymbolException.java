package io.lacuna.scanpath;

/**
 * Thrown when a scanpath contains a token outside the terminal alphabet.
 */
public class InvalidSymbolException extends IllegalArgumentException {

  private final String token;
  private final int index;

  public InvalidSymbolException(String token, int index) {
    super("unrecognized token '" + token + "' at index " + index);
    this.token = token;
    this.index = index;
  }

  public String token() {
    return token;
  }

  public int index() {
    return index;
  }
}
