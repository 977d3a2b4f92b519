package io.lacuna.scanpath;

/**
 * The stack alphabet. Every symbol but {@link #Z0} marks an open examination context.
 */
public enum StackSymbol {

  /** bottom sentinel, never popped */
  Z0,
  /** rhythm context */
  Rm,
  /** lead context */
  Lm,
  /** feature context */
  Fm,
  /** verification context */
  Vm;

  public boolean isContext() {
    return this != Z0;
  }
}
