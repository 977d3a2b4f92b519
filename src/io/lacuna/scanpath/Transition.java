package io.lacuna.scanpath;

import java.util.Objects;

/**
 * A single rule {@code (state, input, top) -> (state, op)}. An {@code input} of {@code null} denotes an
 * epsilon rule, which fires without consuming input.
 */
public final class Transition {

  public enum Op {
    PUSH,
    POP,
    NONE
  }

  /**
   * The triple a rule is looked up by.
   */
  public static final class Key {
    final State state;
    final Symbol input;
    final StackSymbol top;

    Key(State state, Symbol input, StackSymbol top) {
      this.state = state;
      this.input = input;
      this.top = top;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }
      Key k = (Key) o;
      return state == k.state && input == k.input && top == k.top;
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, input, top);
    }

    @Override
    public String toString() {
      return "(" + state + ", " + (input == null ? "ε" : input) + ", " + top + ")";
    }
  }

  private final Key key;
  private final State target;
  private final Op op;
  private final StackSymbol pushed;

  Transition(State from, Symbol input, StackSymbol top, State target, Op op, StackSymbol pushed) {
    if ((op == Op.PUSH) != (pushed != null)) {
      throw new IllegalArgumentException("a pushed symbol must be given for, and only for, push rules");
    }
    if (pushed == StackSymbol.Z0) {
      throw new IllegalArgumentException("Z0 cannot be pushed");
    }
    if (top == StackSymbol.Z0 && op == Op.POP) {
      throw new IllegalArgumentException("Z0 cannot be popped");
    }
    if (input == null && op != Op.NONE) {
      throw new IllegalArgumentException("epsilon rules cannot change the stack");
    }
    this.key = new Key(from, input, top);
    this.target = target;
    this.op = op;
    this.pushed = pushed;
  }

  public Key key() {
    return key;
  }

  public State from() {
    return key.state;
  }

  /**
   * @return the consumed input symbol, or {@code null} for an epsilon rule
   */
  public Symbol input() {
    return key.input;
  }

  public StackSymbol top() {
    return key.top;
  }

  public State target() {
    return target;
  }

  public Op op() {
    return op;
  }

  /**
   * @return the pushed stack symbol, or {@code null} if this is not a push rule
   */
  public StackSymbol pushed() {
    return pushed;
  }

  public boolean isEpsilon() {
    return key.input == null;
  }

  @Override
  public String toString() {
    String effect;
    switch (op) {
      case PUSH:
        effect = "push " + pushed;
        break;
      case POP:
        effect = "pop";
        break;
      default:
        effect = "-";
    }
    return key + " -> (" + target + ", " + effect + ")";
  }
}
