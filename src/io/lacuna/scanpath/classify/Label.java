package io.lacuna.scanpath.classify;

/**
 * The degree of diagnostic verification a scanpath exhibits.
 */
public enum Label {
  COMPLETE,
  INCOMPLETE,
  NONE;

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
