/*
 * Copyright (c) 2025 The findcont Development Team
 */

package io.github.findcont.modules.dataprocessing.contdet_amendmask;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MaskAmendmentTransitionsTest {

  private static final Decision YES = new Decision(DecisionKind.YES_MOM, 4.5, 4.5);
  private static final Decision YES_CUBE = new Decision(DecisionKind.YES_CUBE, 4.5, 4.5);
  private static final Decision NO = new Decision(DecisionKind.NO, 4.5, 4.5);

  private static TransitionInputs inputs(int budget, Decision amend, Decision onlyExtra,
      Decision extra) {
    return new TransitionInputs(budget, false, true, amend, onlyExtra, extra);
  }

  @Test
  void testRulesPerStage() {
    Assertions.assertArrayEquals(
        new DecisionRule[]{DecisionRule.AMEND_MASK, DecisionRule.ONLY_EXTRA_MASK},
        MaskAmendmentTransitions.rulesFor(IterationStage.ORIGINAL));
    for (IterationStage stage : new IterationStage[]{IterationStage.AMENDED_MASK,
        IterationStage.EXTRA_MASK, IterationStage.ONLY_EXTRA_MASK, IterationStage.AUTO_LOWER}) {
      Assertions.assertArrayEquals(new DecisionRule[]{DecisionRule.EXTRA_MASK},
          MaskAmendmentTransitions.rulesFor(stage));
    }
  }

  @Test
  void testOriginalAmendYesGrowsMask() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        inputs(2, YES_CUBE, null, null));
    Assertions.assertEquals(TransitionAction.GROW_MASK, t.action());
    Assertions.assertEquals(IterationStage.AMENDED_MASK, t.next());
    Assertions.assertEquals(DecisionRule.AMEND_MASK, t.rule());
    Assertions.assertSame(YES_CUBE, t.decision());
  }

  @Test
  void testOriginalOnlyExtraYesSynthesizes() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        inputs(2, NO, YES, null));
    Assertions.assertEquals(TransitionAction.SYNTHESIZE, t.action());
    Assertions.assertEquals(IterationStage.ONLY_EXTRA_MASK, t.next());
    Assertions.assertEquals(DecisionRule.ONLY_EXTRA_MASK, t.rule());
  }

  @Test
  void testOriginalBothNoStopsWithOnlyExtraDecision() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        inputs(2, NO, NO, null));
    Assertions.assertTrue(t.isStop());
    Assertions.assertNull(t.next());
    Assertions.assertEquals(DecisionRule.ONLY_EXTRA_MASK, t.rule());
    Assertions.assertNotEquals(IterationStage.AMENDED_MASK, t.next());
  }

  @Test
  void testOriginalWithoutOnlyExtraStopsWithAmendDecision() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        inputs(2, NO, null, null));
    Assertions.assertTrue(t.isStop());
    Assertions.assertEquals(DecisionRule.AMEND_MASK, t.rule());
    Assertions.assertSame(NO, t.decision());
  }

  @Test
  void testAmendedExtraYesSynthesizes() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.AMENDED_MASK,
        inputs(1, null, null, YES));
    Assertions.assertEquals(TransitionAction.SYNTHESIZE, t.action());
    Assertions.assertEquals(IterationStage.EXTRA_MASK, t.next());
  }

  @Test
  void testLaterStagesLowerSigma() {
    for (IterationStage stage : new IterationStage[]{IterationStage.EXTRA_MASK,
        IterationStage.ONLY_EXTRA_MASK, IterationStage.AUTO_LOWER}) {
      StageTransition t = MaskAmendmentTransitions.next(stage, inputs(1, null, null, YES));
      Assertions.assertEquals(TransitionAction.LOWER_SIGMA, t.action());
      Assertions.assertEquals(IterationStage.AUTO_LOWER, t.next());
      Assertions.assertTrue(MaskAmendmentTransitions.next(stage, inputs(1, null, null, NO))
          .isStop());
    }
  }

  @Test
  void testExhaustedBudgetStops() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        inputs(0, YES, null, null));
    Assertions.assertTrue(t.isStop());
    Assertions.assertSame(YES, t.decision());
    Assertions.assertTrue(MaskAmendmentTransitions.next(IterationStage.AMENDED_MASK,
        inputs(0, null, null, YES)).isStop());
  }

  @Test
  void testEmptySelectionOrMissingDiagnosticsStop() {
    StageTransition empty = MaskAmendmentTransitions.next(IterationStage.ORIGINAL,
        new TransitionInputs(2, true, true, YES, null, null));
    Assertions.assertTrue(empty.isStop());
    Assertions.assertNull(empty.rule());
    StageTransition missing = MaskAmendmentTransitions.next(IterationStage.AMENDED_MASK,
        new TransitionInputs(2, false, false, null, null, YES));
    Assertions.assertTrue(missing.isStop());
    Assertions.assertEquals(DecisionKind.NO, missing.decision().kind());
  }

  @Test
  void testMissingDecisionIsNo() {
    StageTransition t = MaskAmendmentTransitions.next(IterationStage.AMENDED_MASK,
        inputs(2, null, null, null));
    Assertions.assertTrue(t.isStop());
    Assertions.assertTrue(Double.isNaN(t.decision().level()));
  }
}
