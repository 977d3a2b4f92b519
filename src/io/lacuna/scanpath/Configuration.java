package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;

/**
 * An immutable automaton configuration: the current state, and the stack. The stack is a persistent list with
 * {@link StackEntry#BOTTOM} at index 0 and the top at the end, so successive configurations share structure.
 */
public final class Configuration {

  private static final Configuration INITIAL =
          new Configuration(State.INITIAL, new List<StackEntry>().addLast(StackEntry.BOTTOM));

  private final State state;
  private final IList<StackEntry> stack;

  private Configuration(State state, IList<StackEntry> stack) {
    this.state = state;
    this.stack = stack;
  }

  /**
   * @return {@code (q0, [Z0])}
   */
  public static Configuration initial() {
    return INITIAL;
  }

  public State state() {
    return state;
  }

  /**
   * @return the stack, bottom first
   */
  public IList<StackEntry> stack() {
    return stack;
  }

  public StackEntry top() {
    return stack.last();
  }

  /**
   * @return the number of open contexts, which excludes the bottom sentinel
   */
  public int depth() {
    return (int) stack.size() - 1;
  }

  public boolean isAccepting() {
    return state.isAccepting();
  }

  Configuration moveTo(State target) {
    return target == state ? this : new Configuration(target, stack);
  }

  Configuration push(State target, StackEntry entry) {
    return new Configuration(target, stack.addLast(entry));
  }

  Configuration pop(State target) {
    if (stack.size() == 1) {
      throw new IllegalStateException("cannot pop the bottom of the stack");
    }
    return new Configuration(target, stack.removeLast());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Configuration)) {
      return false;
    }
    Configuration c = (Configuration) o;
    return state == c.state && stack.equals(c.stack);
  }

  @Override
  public int hashCode() {
    return 31 * state.hashCode() + stack.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(" + state + ", [");
    stack.forEach(e -> sb.append(e).append(", "));
    sb.delete(sb.length() - 2, sb.length());
    sb.append("])");
    return sb.toString();
  }
}
