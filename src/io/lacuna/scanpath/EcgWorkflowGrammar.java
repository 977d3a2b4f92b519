package io.lacuna.scanpath;

import io.lacuna.bifurcan.IList;

import static io.lacuna.scanpath.StackSymbol.*;
import static io.lacuna.scanpath.State.*;
import static io.lacuna.scanpath.Symbol.*;

/**
 * The diagnostic workflow of an ECG read, as a deterministic pushdown automaton.
 *
 * <p>An examiner takes an overview ({@code O}), assesses the rhythm ({@code R}), then examines leads and the
 * waveform features within them. Each lead or feature examined opens a context on the stack, and lead or
 * feature examinations nest within each other. Once verification begins ({@code V}), contexts must be
 * unwound innermost first by a confirmation ({@code ✓}). A lead context may also be closed by looking back at
 * that same lead, or by returning to the overview. When the last context is closed, the read is complete.
 */
public final class EcgWorkflowGrammar {

  private static final IList<Symbol> LEADS = Symbol.ofKind(Kind.LEAD);
  private static final IList<Symbol> FEATURES = Symbol.ofKind(Kind.FEATURE);

  /**
   * The shared, immutable transition table.
   */
  public static final TransitionTable TABLE = rules().build();

  private EcgWorkflowGrammar() {
  }

  /**
   * Rules written over {@code LEADS} or {@code FEATURES} expand to one concrete rule per symbol, so the table
   * holds many more rules than the workflow below lists.
   *
   * @return a builder populated with the workflow's rules, which may be extended before being built
   */
  public static AutomatonBuilder rules() {
    return new AutomatonBuilder()

            // overview
            .from(q0).on(OVERVIEW).over(Z0).to(q1)
            .from(q1).on(OVERVIEW).over(Z0).to(q1)

            // rhythm
            .from(q1).on(RHYTHM).over(Z0).to(q2)
            .from(q2).on(RHYTHM).over(Z0, Rm).to(q2)
            .from(q2).on(LEADS).over(Z0, Rm).push(Lm, q3)
            .from(q2).on(VERIFY).over(Rm).to(q5)

            // lead examination
            .from(q3).on(LEADS).over(Lm).push(Lm, q3)
            .from(q3).on(FEATURES).over(Lm).push(Fm, q4)
            .from(q3).on(RHYTHM).over(Lm).push(Rm, q2)
            .from(q3).on(VERIFY).over(Lm).to(q5)

            // feature examination
            .from(q4).on(FEATURES).over(Fm).to(q4)
            .from(q4).on(LEADS).over(Fm).push(Lm, q3)
            .from(q4).on(RHYTHM).over(Fm).push(Rm, q2)
            .from(q4).on(VERIFY).over(Fm).to(q5)

            // verification, unwinding innermost first
            .from(q5).on(CONFIRM).over(Fm, Lm, Rm, Vm).pop(q5)
            .from(q5).on(LEADS).over(Lm).pop(q5)
            .from(q5).on(LEADS).over(Fm, Rm, Vm).to(q5)
            .from(q5).on(FEATURES).over(Lm, Fm, Vm).to(q5)
            .from(q5).on(VERIFY).over(Lm, Fm, Rm).push(Vm, q5)
            .from(q5).on(VERIFY).over(Vm).to(q5)
            .from(q5).on(OVERVIEW).over(Lm).pop(q5)
            .epsilon(q5, Z0, q6)

            // complete
            .from(q6).on(OVERVIEW).over(Z0).to(q6);
  }
}
