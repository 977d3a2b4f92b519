package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * An immutable, deterministic transition function. Instances are created by {@link AutomatonBuilder#build()},
 * which guarantees that at most one rule exists for any {@code (state, input, top)} triple, and that no state
 * has both an epsilon rule and an input rule for the same stack top.
 *
 * <p>Tables are safe to share between threads.
 */
public final class TransitionTable {

  private final IList<Transition> ordered;
  private final IMap<Transition.Key, Transition> rules;

  TransitionTable(IList<Transition> ordered) {
    this.ordered = ordered.forked();
    this.rules = ordered.stream()
            .collect(Maps.linearCollector(Transition::key, t -> t))
            .forked();
  }

  /**
   * @return the rule matching the triple, or empty if the configuration is dead
   */
  public Optional<Transition> lookup(State state, Symbol input, StackSymbol top) {
    return rules.get(new Transition.Key(state, input, top));
  }

  /**
   * @return the epsilon rule leaving {@code state} when {@code top} is on the stack, if any
   */
  public Optional<Transition> epsilon(State state, StackSymbol top) {
    return rules.get(new Transition.Key(state, null, top));
  }

  /**
   * @return every rule, in the order they were added to the builder
   */
  public IList<Transition> rules() {
    return ordered;
  }

  /**
   * @return the number of rules, epsilon rules included
   */
  public long size() {
    return rules.size();
  }

  /**
   * @return the input symbols which have at least one rule
   */
  public ISet<Symbol> alphabet() {
    return rules.keys().stream()
            .map(k -> k.input)
            .filter(s -> s != null)
            .collect(Sets.linearCollector());
  }
}
