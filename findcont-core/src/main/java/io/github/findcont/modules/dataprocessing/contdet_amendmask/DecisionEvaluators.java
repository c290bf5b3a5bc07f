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

import io.github.findcont.datamodel.diagnostics.MapDiagnostics;
import java.util.logging.Logger;
import org.apache.commons.math3.special.Erf;
import org.jetbrains.annotations.NotNull;

/**
 * Stateless yes/no rules of the mask amendment stages.
 * <p>
 * All three share one shape. The significance level is the larger of a fixed floor and the ten
 * event sigma of the pixel population. A rule says yes if the map SNR exceeds its threshold and
 * more than {@link #MIN_PIXELS} pixels lie above the level, unless the pixel count explodes just
 * below the level or too many pixels are negative.
 */
public final class DecisionEvaluators {

  private static final Logger logger = Logger.getLogger(DecisionEvaluators.class.getName());

  public static final int MIN_PIXELS = 9;
  public static final double TEN_EVENTS = 10;
  public static final double RUNAWAY_PIXEL_RATIO = 2.2;
  public static final double RUNAWAY_SIGMA_STEP = 0.5;
  public static final double NEGATIVE_PIXEL_RATIO = 0.5;

  private DecisionEvaluators() {
  }

  /**
   * sigma = √2·erfinv(1 − events/N), the significance at which the given number of false
   * positives is expected among N Gaussian pixels.
   *
   * @return 0 if the population has no more than the given number of events
   */
  public static double eventSigma(double events, long population) {
    if (population <= events) {
      return 0d;
    }
    return Math.sqrt(2) * Erf.erfInv(1 - events / population);
  }

  public static double tenEventSigma(long population) {
    return eventSigma(TEN_EVENTS, population);
  }

  /**
   * Should the joint mask be grown with the pixels of the signal map?
   *
   * @param cubeSnr a cube SNR above the cube threshold turns a yes into YesCube
   */
  public static @NotNull Decision amendMaskYesOrNo(boolean goodAtmosphere,
      @NotNull MapDiagnostics signalMap, double cubeSnr, @NotNull PixelCounter counter) {
    final DecisionThresholds t = DecisionThresholds.of(DecisionRule.AMEND_MASK, goodAtmosphere);
    final Decision decision = evaluate(DecisionRule.AMEND_MASK, t, signalMap, counter);
    if (decision.isYes() && cubeSnr > t.cubeSnr()) {
      return new Decision(DecisionKind.YES_CUBE, decision.level(), decision.sigmaUsed());
    }
    return decision;
  }

  /**
   * Does the difference map still hold emission the selection missed?
   */
  public static @NotNull Decision extraMaskYesOrNo(boolean goodAtmosphere,
      @NotNull MapDiagnostics differenceMap, @NotNull PixelCounter counter) {
    return evaluate(DecisionRule.EXTRA_MASK,
        DecisionThresholds.of(DecisionRule.EXTRA_MASK, goodAtmosphere), differenceMap, counter);
  }

  /**
   * Weak emission that did not justify a mask amendment may still justify a synthesized spectrum,
   * if the cube itself shows it.
   */
  public static @NotNull Decision onlyExtraMaskYesOrNo(boolean goodAtmosphere,
      @NotNull MapDiagnostics signalMap, double cubeSnr, @NotNull PixelCounter counter) {
    final DecisionThresholds t = DecisionThresholds.of(DecisionRule.ONLY_EXTRA_MASK,
        goodAtmosphere);
    final Decision decision = evaluate(DecisionRule.ONLY_EXTRA_MASK, t, signalMap, counter);
    if (decision.isYes() && !(cubeSnr > t.cubeSnr())) {
      logger.fine(() -> "onlyExtraMask: cube SNR %.2f <= %.2f".formatted(cubeSnr, t.cubeSnr()));
      return new Decision(DecisionKind.NO, decision.level(), decision.sigmaUsed());
    }
    return decision;
  }

  private static Decision evaluate(DecisionRule rule, DecisionThresholds t, MapDiagnostics map,
      PixelCounter counter) {
    final double sigmaUsed = Math.max(t.floor(), tenEventSigma(map.pixelCount()));
    final double level = map.level(sigmaUsed);
    final double snr = map.snr();
    if (!(snr > t.snr())) {
      logger.fine(() -> "%s: SNR %.2f <= %.2f".formatted(rule, snr, t.snr()));
      return new Decision(DecisionKind.NO, level, sigmaUsed);
    }

    final long above = counter.count(level, true);
    final long aboveLower = counter.count(map.level(sigmaUsed - RUNAWAY_SIGMA_STEP), true);
    final long negative = counter.count(map.level(-sigmaUsed), false);
    if (above < 0 || aboveLower < 0 || negative < 0) {
      logger.fine(() -> rule + ": pixel counts unavailable");
      return Decision.missing();
    }
    if (above <= MIN_PIXELS) {
      logger.fine(() -> "%s: only %d pixels above %.4g".formatted(rule, above, level));
      return new Decision(DecisionKind.NO, level, sigmaUsed);
    }
    final double runaway = (double) aboveLower / above;
    if (runaway > RUNAWAY_PIXEL_RATIO) {
      logger.fine(() -> "%s: runaway pixel ratio %.2f".formatted(rule, runaway));
      return new Decision(DecisionKind.NO, level, sigmaUsed);
    }
    final double negativeRatio = (double) negative / above;
    if (negativeRatio > NEGATIVE_PIXEL_RATIO) {
      logger.fine(() -> "%s: negative pixel ratio %.2f".formatted(rule, negativeRatio));
      return new Decision(DecisionKind.NO, level, sigmaUsed);
    }
    logger.fine(() -> "%s: yes, SNR %.2f, %d pixels above %.2f sigma".formatted(rule, snr, above,
        sigmaUsed));
    return new Decision(DecisionKind.YES_MOM, level, sigmaUsed);
  }
}
