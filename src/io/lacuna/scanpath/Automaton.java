package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A deterministic pushdown automaton over a {@link TransitionTable}. Runs hold no state between calls, so a
 * single instance may be shared between threads.
 *
 * @author ztellman
 */
public class Automaton {

  private static final Logger LOGGER = LoggerFactory.getLogger(Automaton.class);

  private static final Automaton ECG_WORKFLOW = new Automaton(EcgWorkflowGrammar.TABLE);

  /**
   * The result of consuming a single symbol: either the next configuration, or the reason there is none.
   */
  public static final class Step {
    private final Configuration configuration;
    private final Transition transition;
    private final Rejection.Reason failure;

    private Step(Configuration configuration, Transition transition, Rejection.Reason failure) {
      this.configuration = configuration;
      this.transition = transition;
      this.failure = failure;
    }

    public boolean isRejected() {
      return failure != null;
    }

    /**
     * @return the configuration after the input rule and any epsilon rules, or the unchanged configuration if
     * rejected
     */
    public Configuration configuration() {
      return configuration;
    }

    /**
     * @return the input rule that was applied, if not rejected
     */
    public Optional<Transition> transition() {
      return Optional.ofNullable(transition);
    }

    public Optional<Rejection.Reason> failure() {
      return Optional.ofNullable(failure);
    }
  }

  private final TransitionTable table;

  public Automaton(TransitionTable table) {
    this.table = Validate.notNull(table, "table must not be null");
  }

  /**
   * @return the automaton for the ECG diagnostic workflow
   */
  public static Automaton ecgWorkflow() {
    return ECG_WORKFLOW;
  }

  public TransitionTable table() {
    return table;
  }

  /**
   * @return the configuration reached by following epsilon rules from {@code c}
   */
  public Configuration close(Configuration c) {
    for (; ; ) {
      Optional<Transition> eps = table.epsilon(c.state(), c.top().symbol());
      if (!eps.isPresent() || eps.get().target() == c.state()) {
        return c;
      }
      c = c.moveTo(eps.get().target());
    }
  }

  /**
   * Consumes a single symbol.
   */
  public Step step(Configuration c, Symbol symbol) {
    Validate.notNull(c, "configuration must not be null");
    Validate.notNull(symbol, "symbol must not be null");

    StackEntry top = c.top();
    Optional<Transition> rule = table.lookup(c.state(), symbol, top.symbol());
    if (!rule.isPresent()) {
      return new Step(c, null, Rejection.Reason.DEAD_CONFIGURATION);
    }

    Transition t = rule.get();
    Configuration next;
    switch (t.op()) {
      case PUSH:
        next = c.push(t.target(), StackEntry.of(t.pushed(), symbol));
        break;
      case POP:
        if (!top.matches(symbol)) {
          return new Step(c, null, Rejection.Reason.MISMATCHED_VERIFICATION);
        }
        next = c.pop(t.target());
        break;
      default:
        next = c.moveTo(t.target());
    }

    return new Step(close(next), t, null);
  }

  /**
   * Runs the automaton over the entire scanpath, stopping at the first dead configuration.
   */
  public RunTrace run(Scanpath scanpath) {
    Validate.notNull(scanpath, "scanpath must not be null");

    LinearList<Configuration> configurations = new LinearList<>();
    LinearList<Integer> depths = new LinearList<>();
    LinearMap<StackSymbol, Long> pushes = new LinearMap<>();
    LinearMap<StackSymbol, Long> pops = new LinearMap<>();
    long verified = 0;

    Configuration c = close(Configuration.initial());
    configurations.addLast(c);
    int maxDepth = c.depth();

    for (int i = 0; i < scanpath.size(); i++) {
      Symbol symbol = scanpath.nth(i);
      Step step = step(c, symbol);

      if (step.isRejected()) {
        Rejection rejection = new Rejection(step.failure().get(), i, symbol, c);
        LOGGER.debug("rejected {}: {}", scanpath, rejection);
        return new RunTrace(configurations, depths, pushes, pops, verified, maxDepth, i, rejection);
      }

      Transition t = step.transition().get();
      if (t.op() == Transition.Op.PUSH) {
        Utils.increment(pushes, t.pushed());
      } else if (t.op() == Transition.Op.POP) {
        Utils.increment(pops, c.top().symbol());
        verified++;
      }

      if (step.configuration().state() != t.target()) {
        configurations.addLast(step.configuration().moveTo(t.target()));
      }
      c = step.configuration();
      configurations.addLast(c);
      depths.addLast(c.depth());
      maxDepth = Math.max(maxDepth, c.depth());
    }

    return new RunTrace(configurations, depths, pushes, pops, verified, maxDepth, scanpath.size(), null);
  }

  /**
   * @return true if the scanpath is in the language recognized by this automaton
   */
  public boolean accepts(Scanpath scanpath) {
    return run(scanpath).accepted();
  }
}
