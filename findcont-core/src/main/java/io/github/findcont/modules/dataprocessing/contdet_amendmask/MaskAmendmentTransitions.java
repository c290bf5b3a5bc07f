/*
 * Copyright (c) 2025 The findcont Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.findcont.modules.dataprocessing.contdet_amendmask;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Transition table of the mask amendment.
 * <pre>
 * ORIGINAL      --amend yes-------------------> AMENDED_MASK     (grow mask)
 * ORIGINAL      --amend no, only extra yes----> ONLY_EXTRA_MASK  (synthesize)
 * AMENDED_MASK  --extra yes-------------------> EXTRA_MASK       (synthesize)
 * EXTRA_MASK, ONLY_EXTRA_MASK, AUTO_LOWER
 *               --extra yes-------------------> AUTO_LOWER       (lower sigma)
 * any           --no, budget exhausted, empty selection, missing diagnostics--> STOP
 * </pre>
 */
public final class MaskAmendmentTransitions {

  private MaskAmendmentTransitions() {
  }

  /**
   * @return the decision rules the driver has to evaluate for a stage, in this order. The second
   * rule of ORIGINAL is only needed if the first says no.
   */
  public static DecisionRule[] rulesFor(@NotNull IterationStage stage) {
    return switch (stage) {
      case ORIGINAL -> new DecisionRule[]{DecisionRule.AMEND_MASK, DecisionRule.ONLY_EXTRA_MASK};
      case AMENDED_MASK, EXTRA_MASK, ONLY_EXTRA_MASK, AUTO_LOWER ->
          new DecisionRule[]{DecisionRule.EXTRA_MASK};
    };
  }

  public static @NotNull StageTransition next(@NotNull IterationStage current,
      @NotNull TransitionInputs in) {
    if (in.selectionEmpty() || !in.diagnosticsAvailable()) {
      return StageTransition.stop(Decision.missing(), null);
    }
    return switch (current) {
      case ORIGINAL -> {
        final Decision amend = orMissing(in.amend());
        if (amend.isYes()) {
          yield advance(in, IterationStage.AMENDED_MASK, TransitionAction.GROW_MASK, amend,
              DecisionRule.AMEND_MASK);
        }
        if (in.onlyExtra() == null) {
          yield StageTransition.stop(amend, DecisionRule.AMEND_MASK);
        }
        yield advance(in, IterationStage.ONLY_EXTRA_MASK, TransitionAction.SYNTHESIZE,
            in.onlyExtra(), DecisionRule.ONLY_EXTRA_MASK);
      }
      case AMENDED_MASK -> advance(in, IterationStage.EXTRA_MASK, TransitionAction.SYNTHESIZE,
          orMissing(in.extra()), DecisionRule.EXTRA_MASK);
      case EXTRA_MASK, ONLY_EXTRA_MASK, AUTO_LOWER ->
          advance(in, IterationStage.AUTO_LOWER, TransitionAction.LOWER_SIGMA,
              orMissing(in.extra()), DecisionRule.EXTRA_MASK);
    };
  }

  private static StageTransition advance(TransitionInputs in, IterationStage next,
      TransitionAction action, Decision decision, DecisionRule rule) {
    if (!decision.isYes() || in.remainingBudget() <= 0) {
      return StageTransition.stop(decision, rule);
    }
    return new StageTransition(action, next, decision, rule);
  }

  private static Decision orMissing(@Nullable Decision decision) {
    return decision == null ? Decision.missing() : decision;
  }
}
