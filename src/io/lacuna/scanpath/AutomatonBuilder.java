package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Accumulates transition rules, and compiles them into an immutable {@link TransitionTable}.
 *
 * <pre>{@code
 * new AutomatonBuilder()
 *     .from(State.q2).on(leads).over(StackSymbol.Z0, StackSymbol.Rm).push(StackSymbol.Lm, State.q3)
 *     .epsilon(State.q5, StackSymbol.Z0, State.q6)
 *     .build();
 * }</pre>
 *
 * Rules over several inputs or stack tops are expanded into one rule per combination.
 */
public class AutomatonBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutomatonBuilder.class);

  private final LinearList<Transition> rules = new LinearList<>();
  private final LinearMap<Transition.Key, Transition> index = new LinearMap<>();
  private final LinearList<String> conflicts = new LinearList<>();

  /**
   * A partially specified family of rules, completed by {@link #to(State)}, {@link #push(StackSymbol, State)},
   * or {@link #pop(State)}.
   */
  public final class RuleSpec {

    private final State from;
    private IList<Symbol> inputs = new LinearList<>();
    private IList<StackSymbol> tops = new LinearList<>();

    private RuleSpec(State from) {
      this.from = from;
    }

    public RuleSpec on(Symbol... inputs) {
      return on(LinearList.of(inputs));
    }

    public RuleSpec on(IList<Symbol> inputs) {
      Validate.notNull(inputs, "inputs must not be null");
      Validate.isTrue(inputs.size() > 0, "at least one input must be given");
      this.inputs = inputs;
      return this;
    }

    public RuleSpec over(StackSymbol... tops) {
      Validate.isTrue(tops.length > 0, "at least one stack top must be given");
      this.tops = LinearList.of(tops);
      return this;
    }

    /**
     * @return the builder, extended to move to {@code target} without touching the stack
     */
    public AutomatonBuilder to(State target) {
      return emit(target, Transition.Op.NONE, null);
    }

    /**
     * @return the builder, extended to move to {@code target} and push {@code symbol} above the current top
     */
    public AutomatonBuilder push(StackSymbol symbol, State target) {
      Validate.notNull(symbol, "symbol must not be null");
      return emit(target, Transition.Op.PUSH, symbol);
    }

    /**
     * @return the builder, extended to move to {@code target} and pop the current top
     */
    public AutomatonBuilder pop(State target) {
      return emit(target, Transition.Op.POP, null);
    }

    private AutomatonBuilder emit(State target, Transition.Op op, StackSymbol pushed) {
      Validate.notNull(target, "target must not be null");
      Validate.validState(inputs.size() > 0, "no inputs given for rules leaving %s", from);
      Validate.validState(tops.size() > 0, "no stack tops given for rules leaving %s", from);

      for (Symbol input : inputs) {
        for (StackSymbol top : tops) {
          add(new Transition(from, input, top, target, op, pushed));
        }
      }
      return AutomatonBuilder.this;
    }
  }

  /// rules

  public RuleSpec from(State state) {
    Validate.notNull(state, "state must not be null");
    return new RuleSpec(state);
  }

  /**
   * @return the current builder, extended to move from {@code from} to {@code target} without consuming input
   * whenever {@code top} is on top of the stack
   */
  public AutomatonBuilder epsilon(State from, StackSymbol top, State target) {
    Validate.notNull(from, "from must not be null");
    Validate.notNull(top, "top must not be null");
    Validate.notNull(target, "target must not be null");
    add(new Transition(from, null, top, target, Transition.Op.NONE, null));
    return this;
  }

  private void add(Transition t) {
    Optional<Transition> existing = index.get(t.key());
    if (existing.isPresent()) {
      conflicts.addLast(existing.get() + " conflicts with " + t);
    } else {
      index.put(t.key(), t);
      rules.addLast(t);
    }
  }

  ///

  /**
   * @return the number of distinct rules added so far
   */
  public long size() {
    return rules.size();
  }

  /**
   * @throws IllegalStateException if two rules share a {@code (state, input, top)} triple, if a state has
   *                               both an epsilon rule and an input rule for the same stack top, or if epsilon
   *                               rules lead back to where they started
   */
  public TransitionTable build() {
    LinearList<String> errors = LinearList.from(conflicts);

    ISet<Transition.Key> epsilons = rules.stream()
            .filter(Transition::isEpsilon)
            .map(t -> new Transition.Key(t.from(), null, t.top()))
            .collect(Sets.linearCollector());

    for (Transition t : rules) {
      if (!t.isEpsilon() && epsilons.contains(new Transition.Key(t.from(), null, t.top()))) {
        errors.addLast(t + " is shadowed by an epsilon rule on " + t.from() + "/" + t.top());
      }
    }

    for (Transition t : rules) {
      if (t.isEpsilon() && epsilonCycle(t)) {
        errors.addLast(t + " is part of an epsilon cycle on " + t.top());
      }
    }

    if (errors.size() > 0) {
      errors.forEach(e -> LOGGER.error("non-deterministic rule: {}", e));
      throw new IllegalStateException("transition table is not deterministic: " + errors.nth(0)
              + (errors.size() > 1 ? " (and " + (errors.size() - 1) + " more)" : ""));
    }

    LOGGER.debug("built transition table with {} rules over {} states", rules.size(),
            rules.stream().map(Transition::from).distinct().count());

    return new TransitionTable(rules);
  }

  // epsilon rules never touch the stack, so a chain of them stays on the same top
  private boolean epsilonCycle(Transition start) {
    LinearSet<State> visited = new LinearSet<>();
    State state = start.target();
    while (!visited.contains(state)) {
      if (state == start.from()) {
        return true;
      }
      visited.add(state);
      Optional<Transition> next = index.get(new Transition.Key(state, null, start.top()));
      if (!next.isPresent()) {
        return false;
      }
      state = next.get().target();
    }
    return false;
  }
}
