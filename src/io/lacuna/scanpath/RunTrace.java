package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * The record of a single run: every configuration visited, and the stack operations performed along the way.
 * Produced by {@link Automaton#run(Scanpath)}.
 */
public final class RunTrace {

  public enum Outcome {
    /** all input consumed, ending in the accepting state */
    ACCEPTED,
    /** all input consumed without reaching the accepting state */
    UNTERMINATED,
    /** a dead configuration was reached before the input was consumed */
    REJECTED
  }

  private final IList<Configuration> configurations;
  private final IList<Integer> depths;
  private final IMap<StackSymbol, Long> pushes;
  private final IMap<StackSymbol, Long> pops;
  private final long verifiedPops;
  private final int maxDepth;
  private final int consumed;
  private final Rejection rejection;

  RunTrace(IList<Configuration> configurations,
           IList<Integer> depths,
           IMap<StackSymbol, Long> pushes,
           IMap<StackSymbol, Long> pops,
           long verifiedPops,
           int maxDepth,
           int consumed,
           Rejection rejection) {
    this.configurations = configurations.forked();
    this.depths = depths.forked();
    this.pushes = pushes.forked();
    this.pops = pops.forked();
    this.verifiedPops = verifiedPops;
    this.maxDepth = maxDepth;
    this.consumed = consumed;
    this.rejection = rejection;
  }

  public Outcome outcome() {
    if (rejection != null) {
      return Outcome.REJECTED;
    }
    return last().isAccepting() ? Outcome.ACCEPTED : Outcome.UNTERMINATED;
  }

  public boolean accepted() {
    return outcome() == Outcome.ACCEPTED;
  }

  /**
   * @return the configurations visited, starting with the initial configuration, and including those reached
   * by epsilon rules
   */
  public IList<Configuration> configurations() {
    return configurations;
  }

  /**
   * @return the final configuration, or the one the run was rejected in
   */
  public Configuration last() {
    return configurations.last();
  }

  /**
   * @return the stack depth after each consumed symbol
   */
  public IList<Integer> depths() {
    return depths;
  }

  /**
   * @return the number of input symbols consumed
   */
  public int consumed() {
    return consumed;
  }

  public Optional<Rejection> rejection() {
    return Optional.ofNullable(rejection);
  }

  public int maxDepth() {
    return maxDepth;
  }

  public long pushes(StackSymbol symbol) {
    return pushes.get(symbol, 0L);
  }

  public long pops(StackSymbol symbol) {
    return pops.get(symbol, 0L);
  }

  public long totalPushes() {
    return pushes.values().stream().mapToLong(Long::longValue).sum();
  }

  public long totalPops() {
    return pops.values().stream().mapToLong(Long::longValue).sum();
  }

  /**
   * @return the number of contexts closed by a verification event matching them
   */
  public long verifiedPops() {
    return verifiedPops;
  }

  @Override
  public String toString() {
    return "RunTrace[" + outcome() + ", consumed=" + consumed + ", maxDepth=" + maxDepth
            + ", pushes=" + totalPushes() + ", pops=" + totalPops() + ", last=" + last() + "]";
  }
}
