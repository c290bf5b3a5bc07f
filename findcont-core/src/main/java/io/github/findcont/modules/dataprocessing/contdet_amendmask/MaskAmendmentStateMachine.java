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

import com.google.common.collect.Range;
import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.datamodel.SpectralSetup;
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.datamodel.diagnostics.MapType;
import io.github.findcont.datamodel.diagnostics.StageDiagnostics;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassification;
import io.github.findcont.modules.dataprocessing.contdet_sigma.SigmaAdjuster;
import io.github.findcont.modules.dataprocessing.contdet_sigma.SigmaAdjustment;
import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters;
import io.github.findcont.parameters.ParameterSet;
import io.github.findcont.util.ChannelGroupUtils;
import io.github.findcont.util.MathUtils;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Drives the stages of a continuum finding run.
 * <p>
 * Every stage classifies its spectrum, hands the selection to the image statistics provider and
 * asks {@link MaskAmendmentTransitions} what to do next. The ORIGINAL stage is kept for the whole
 * run: if the amendment made the difference map worse in every aspect, its selection is restored.
 * A collaborator that fails or returns nothing stops the amendment, it never grows a mask or lowers
 * sigma.
 *
 * @param <M> joint mask type of the collaborators
 */
public class MaskAmendmentStateMachine<M> {

  private static final Logger logger = Logger.getLogger(
      MaskAmendmentStateMachine.class.getName());

  private final SigmaAdjuster sigmaAdjuster;
  private final ImageStatisticsProvider<M> imageStatistics;
  private final MaskGrowthCollaborator<M> maskGrowth;
  private final SpectrumSynthesisCollaborator<M> spectrumSynthesis;

  private final int maxAmendIterations;
  private final double autoLowerSigmaFraction;
  private final FourLetterCodeClassifier codeClassifier;
  private final FourLetterCodeClassifier looseCodeClassifier;
  private final double lowBandwidthFraction;
  private final double lowSpreadFraction;
  private final double narrowRangeFraction;
  private final int noiseSeed;

  public MaskAmendmentStateMachine(@NotNull ParameterSet parameters,
      @NotNull SigmaAdjuster sigmaAdjuster, @NotNull ImageStatisticsProvider<M> imageStatistics,
      @NotNull MaskGrowthCollaborator<M> maskGrowth,
      @NotNull SpectrumSynthesisCollaborator<M> spectrumSynthesis) {
    this.sigmaAdjuster = sigmaAdjuster;
    this.imageStatistics = imageStatistics;
    this.maskGrowth = maskGrowth;
    this.spectrumSynthesis = spectrumSynthesis;
    maxAmendIterations = parameters.getValue(FindContinuumParameters.maxAmendIterations);
    autoLowerSigmaFraction = parameters.getValue(FindContinuumParameters.autoLowerSigmaFraction);
    codeClassifier = new FourLetterCodeClassifier(
        parameters.getValue(FindContinuumParameters.fourLetterThreshold));
    looseCodeClassifier = new FourLetterCodeClassifier(
        parameters.getValue(FindContinuumParameters.looseFourLetterThreshold));
    lowBandwidthFraction = parameters.getValue(FindContinuumParameters.lowBandwidthFraction);
    lowSpreadFraction = parameters.getValue(FindContinuumParameters.lowSpreadFraction);
    narrowRangeFraction = parameters.getValue(FindContinuumParameters.narrowRangeFraction);
    noiseSeed = parameters.getValue(FindContinuumParameters.noiseSeed);
  }

  /**
   * @param spectrum       mean spectrum of the initial joint mask
   * @param initialMask    joint mask of the ORIGINAL stage
   * @param initialSigma   starting sigma
   * @param goodAtmosphere selects the lower decision threshold table
   */
  public @NotNull FindContinuumResult run(@NotNull Spectrum spectrum, @NotNull SpectralSetup setup,
      @NotNull M initialMask, double initialSigma, boolean goodAtmosphere) {
    final List<StageResult> history = new ArrayList<>();
    final List<M> masks = new ArrayList<>();

    IterationStage stage = IterationStage.ORIGINAL;
    Spectrum current = spectrum;
    M mask = initialMask;
    double sigma = initialSigma;
    // a grown mask keeps the auto-lower sigma handling for every later stage
    boolean autoLowerMode = false;

    while (true) {
      final SigmaAdjustment adjustment = sigmaAdjuster.adjust(current, setup, sigma,
          autoLowerMode || stage == IterationStage.AUTO_LOWER);
      final ChannelClassification classification = adjustment.classification();
      ChannelSelection selection = classification.selection();
      final StageResult previous = history.isEmpty() ? null : history.get(history.size() - 1);

      if (previous != null && stage.intersectsWithPrevious()) {
        final ChannelSelection intersection = previous.selection().intersect(selection);
        if (intersection.isEmpty()) {
          final IterationStage revertedStage = stage;
          final ChannelSelection rejected = selection;
          logger.info(() -> "%s: %s does not overlap %s, reverting".formatted(revertedStage,
              rejected, previous.selection()));
          history.add(new StageResult(stage, previous.selection(), previous.classification(),
              previous.diagnostics(), StageTransition.stop(Decision.missing(), null)));
          masks.add(mask);
          break;
        }
        selection = intersection;
      }
      if (previous != null && selection.equals(previous.selection())) {
        final IterationStage noImprovementStage = stage;
        logger.info(() -> noImprovementStage + ": selection unchanged, no improvement");
        history.add(new StageResult(stage, selection, classification, previous.diagnostics(),
            StageTransition.stop(Decision.noImprovement(classification.sigma()), null)));
        masks.add(mask);
        break;
      }

      final StageDiagnostics diagnostics = measure(stage, selection, mask);
      final int remainingBudget = maxAmendIterations - history.size();
      final StageTransition transition = decide(stage, selection, mask, diagnostics,
          remainingBudget, goodAtmosphere);
      final StageResult result = new StageResult(stage, selection, classification, diagnostics,
          transition);
      history.add(result);
      masks.add(mask);
      final IterationStage finished = stage;
      logger.info(() -> "%s: %d continuum channels in %d ranges (sigma=%.2f), decision %s -> %s"
          .formatted(finished, result.selection().getChannelCount(),
              result.selection().getNumberOfRanges(), result.sigma(), transition.decision().kind(),
              transition.isStop() ? "STOP" : transition.next()));
      if (transition.isStop()) {
        break;
      }

      // execute the action
      final Decision decision = transition.decision();
      switch (transition.action()) {
        case GROW_MASK -> {
          final M stageMask = mask;
          final M grown = call("grow mask",
              () -> maskGrowth.growMask(stageMask, decision.level()));
          final Spectrum grownSpectrum = grown == null ? null
              : call("extract spectrum for mask", () -> maskGrowth.spectrumForMask(grown));
          if (grown == null || !compatible(grownSpectrum, spectrum)) {
            history.set(history.size() - 1, result.withTransition(
                StageTransition.stop(Decision.missing(), transition.rule())));
            break;
          }
          mask = grown;
          current = grownSpectrum;
          autoLowerMode = true;
        }
        case SYNTHESIZE -> {
          final MapType map =
              stage == IterationStage.ORIGINAL ? MapType.SIGNAL : MapType.DIFFERENCE;
          final ExcessRegion region = new ExcessRegion(map, decision.level(), selection);
          final M stageMask = mask;
          final Spectrum synthesized = call("synthesize spectrum",
              () -> spectrumSynthesis.synthesize(region, stageMask));
          if (!compatible(synthesized, spectrum)) {
            history.set(history.size() - 1, result.withTransition(
                StageTransition.stop(Decision.missing(), transition.rule())));
            break;
          }
          current = injectNoise(synthesized, selection);
        }
        case LOWER_SIGMA -> {
          // same spectrum, sigma is lowered below
        }
        case STOP -> throw new IllegalStateException("STOP is handled above");
      }
      if (history.get(history.size() - 1).transition().isStop()) {
        break;
      }
      sigma = transition.action() == TransitionAction.LOWER_SIGMA ?
          classification.sigma() * autoLowerSigmaFraction : classification.sigma();
      stage = transition.next();
    }

    return finish(spectrum, history, masks, goodAtmosphere);
  }

  private FindContinuumResult finish(Spectrum spectrum, List<StageResult> history, List<M> masks,
      boolean goodAtmosphere) {
    final int n = spectrum.getNumberOfChannels();
    final StageResult original = history.get(0);
    int acceptedIndex = history.size() - 1;
    // never end empty while an earlier stage found continuum
    while (acceptedIndex > 0 && history.get(acceptedIndex).selection().isEmpty()) {
      acceptedIndex--;
    }
    StageResult accepted = history.get(acceptedIndex);

    boolean reverted = false;
    FourLetterCode code = null;
    if (acceptedIndex > 0 && original.diagnostics() != null) {
      final StageDiagnostics after =
          accepted.diagnostics() != null ? accepted.diagnostics() : original.diagnostics();
      code = codeClassifier.compute(original.diagnostics().differenceMap(),
          after.differenceMap());
      final double floor = DecisionThresholds.of(DecisionRule.EXTRA_MASK, goodAtmosphere)
          .floor();
      if (code.isAllWorse() && after.differenceMap().snr() > floor) {
        final FourLetterCode worse = code;
        logger.info(() -> "Difference map got worse (%s), reverting to the original selection %s"
            .formatted(worse, original.selection()));
        accepted = original;
        acceptedIndex = 0;
        reverted = true;
      }
    }

    ChannelSelection selection = accepted.selection();
    boolean appended = false;
    final Set<ContinuumWarning> warnings = warnings(selection, n);
    if (warnings.contains(ContinuumWarning.LOW_BANDWIDTH) && warnings.contains(
        ContinuumWarning.LOW_SPREAD) && !selection.isEmpty()) {
      final ChannelSelection widened = appendOppositeBaselineRange(selection, original, n,
          accepted.diagnostics() != null ? accepted.diagnostics() : original.diagnostics(),
          masks.get(acceptedIndex));
      if (widened != null) {
        selection = widened;
        appended = true;
      }
    }

    final ChannelSelection finalSelection = selection;
    final Set<ContinuumWarning> finalWarnings = warnings(finalSelection, n);
    if (!finalWarnings.isEmpty()) {
      logger.warning(() -> "Continuum selection %s: %s".formatted(finalSelection, finalWarnings));
    }
    return new FindContinuumResult(finalSelection, accepted.sigma(), history,
        accepted.classification().droppedRangeCount(), finalWarnings, reverted, appended, code);
  }

  /**
   * Appends the longest run of unselected baseline channels from the half of the band opposite
   * the selection, if that does not make the difference map mostly worse.
   *
   * @return the widened selection or null
   */
  private @Nullable ChannelSelection appendOppositeBaselineRange(ChannelSelection selection,
      StageResult original, int n, @Nullable StageDiagnostics before, M mask) {
    final double centre = (selection.getFirstChannel() + selection.getLastChannel()) / 2.0;
    final boolean useUpperHalf = centre < n / 2.0;
    final int[] candidates = original.classification().statistics().baselineChannels().stream()
        .filter(c -> useUpperHalf ? c >= n / 2.0 : c < n / 2.0)
        .filter(c -> !selection.contains(c)).sorted().toArray();
    if (candidates.length == 0) {
      return null;
    }
    final int[] run = ChannelGroupUtils.splitIntoContiguousGroups(candidates).stream()
        .max((a, b) -> Integer.compare(a.length, b.length)).orElseThrow();
    final ChannelSelection widened = selection.union(
        ChannelSelection.of(run[0], run[run.length - 1]));
    if (before == null) {
      logger.fine("No diagnostics to validate the appended range");
      return null;
    }
    final StageDiagnostics after = call("measure widened selection",
        () -> imageStatistics.measure(widened, mask));
    if (after == null) {
      return null;
    }
    final FourLetterCode code = looseCodeClassifier.compute(before.differenceMap(),
        after.differenceMap());
    if (code.isMostlyHigher()) {
      logger.info(() -> "Appended range %d~%d made things worse (%s), removing it".formatted(
          run[0], run[run.length - 1], code));
      return null;
    }
    logger.info(() -> "Appended range %d~%d to widen the selection (%s)".formatted(run[0],
        run[run.length - 1], code));
    return widened;
  }

  Set<ContinuumWarning> warnings(ChannelSelection selection, int n) {
    final Set<ContinuumWarning> warnings = EnumSet.noneOf(ContinuumWarning.class);
    final int count = selection.getChannelCount();
    if (count < lowBandwidthFraction * n) {
      warnings.add(ContinuumWarning.LOW_BANDWIDTH);
    }
    final int spread =
        selection.isEmpty() ? 0 : selection.getLastChannel() - selection.getFirstChannel() + 1;
    if (spread < lowSpreadFraction * n) {
      warnings.add(ContinuumWarning.LOW_SPREAD);
    }
    if (selection.getNumberOfRanges() == 1 && count < narrowRangeFraction * n) {
      warnings.add(ContinuumWarning.SINGLE_NARROW_RANGE);
    }
    return warnings;
  }

  private @Nullable StageDiagnostics measure(IterationStage stage, ChannelSelection selection,
      M mask) {
    if (selection.isEmpty()) {
      return null;
    }
    return call(stage + " image statistics", () -> imageStatistics.measure(selection, mask));
  }

  private StageTransition decide(IterationStage stage, ChannelSelection selection, M mask,
      @Nullable StageDiagnostics diagnostics, int remainingBudget, boolean goodAtmosphere) {
    if (diagnostics == null) {
      return MaskAmendmentTransitions.next(stage,
          new TransitionInputs(remainingBudget, selection.isEmpty(), false, null, null, null));
    }
    Decision amend = null, onlyExtra = null, extra = null;
    for (DecisionRule rule : MaskAmendmentTransitions.rulesFor(stage)) {
      switch (rule) {
        case AMEND_MASK -> amend = evaluate(rule,
            () -> DecisionEvaluators.amendMaskYesOrNo(goodAtmosphere, diagnostics.signalMap(),
                diagnostics.cubeSnr(), counter(selection, mask, MapType.SIGNAL)));
        case ONLY_EXTRA_MASK -> {
          if (amend == null || !amend.isYes()) {
            onlyExtra = evaluate(rule,
                () -> DecisionEvaluators.onlyExtraMaskYesOrNo(goodAtmosphere,
                    diagnostics.signalMap(), diagnostics.cubeSnr(),
                    counter(selection, mask, MapType.SIGNAL)));
          }
        }
        case EXTRA_MASK -> extra = evaluate(rule,
            () -> DecisionEvaluators.extraMaskYesOrNo(goodAtmosphere,
                diagnostics.differenceMap(), counter(selection, mask, MapType.DIFFERENCE)));
      }
    }
    return MaskAmendmentTransitions.next(stage,
        new TransitionInputs(remainingBudget, selection.isEmpty(), true, amend, onlyExtra,
            extra));
  }

  private PixelCounter counter(ChannelSelection selection, M mask, MapType map) {
    return (level, above) -> imageStatistics.countPixels(selection, mask, map, level, above);
  }

  private Decision evaluate(DecisionRule rule, Supplier<Decision> evaluator) {
    final Decision decision = call(rule + " decision", evaluator);
    return decision == null ? Decision.missing() : decision;
  }

  /**
   * Replaces the values of all line channels by Gaussian noise. Each line range gets the median and
   * scaled MAD of the continuum ranges next to it, or of all continuum channels if its neighbours
   * have fewer than 2 valid channels. The seed is fixed, so runs are reproducible.
   */
  Spectrum injectNoise(@NotNull Spectrum synthesized, @NotNull ChannelSelection continuum) {
    final int[] channels = validChannels(synthesized, continuum.getRanges());
    if (channels.length < 2) {
      return synthesized;
    }
    final RandomGenerator random = new Well19937c(noiseSeed);
    final double[] values = synthesized.getValues();
    for (Range<Integer> line : continuum.complement(values.length).getRanges()) {
      final List<Range<Integer>> neighbours = continuum.getRanges().stream().filter(
          r -> r.upperEndpoint() == line.lowerEndpoint() - 1
              || r.lowerEndpoint() == line.upperEndpoint() + 1).toList();
      int[] local = validChannels(synthesized, neighbours);
      if (local.length < 2) {
        local = channels;
      }
      final double[] localValues = synthesized.getValues(local);
      final double median = MathUtils.median(localValues);
      final double scaledMad = MathUtils.scaledMad(localValues);
      for (int c = line.lowerEndpoint(); c <= line.upperEndpoint(); c++) {
        if (synthesized.isValid(c)) {
          values[c] = median + scaledMad * random.nextGaussian();
        }
      }
    }
    return synthesized.withValues(values);
  }

  private static int[] validChannels(Spectrum spectrum, List<Range<Integer>> ranges) {
    return ranges.stream()
        .flatMapToInt(r -> IntStream.rangeClosed(r.lowerEndpoint(), r.upperEndpoint()))
        .filter(spectrum::isValid).toArray();
  }

  private static boolean compatible(@Nullable Spectrum candidate, Spectrum reference) {
    if (candidate == null) {
      return false;
    }
    if (candidate.getNumberOfChannels() != reference.getNumberOfChannels()) {
      logger.warning(() -> "Collaborator returned %d channels instead of %d".formatted(
          candidate.getNumberOfChannels(), reference.getNumberOfChannels()));
      return false;
    }
    return true;
  }

  /**
   * Collaborator failures are logged and end up as missing data.
   */
  private static <T> @Nullable T call(String what, Supplier<T> call) {
    try {
      final T value = call.get();
      if (value == null) {
        logger.warning(() -> "No result for " + what);
      }
      return value;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to " + what + ": " + e.getMessage(), e);
      return null;
    }
  }
}
