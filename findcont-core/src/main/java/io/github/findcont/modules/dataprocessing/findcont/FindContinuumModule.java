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

package io.github.findcont.modules.dataprocessing.findcont;

import io.github.findcont.datamodel.SpectralSetup;
import io.github.findcont.datamodel.Spectrum;
import io.github.findcont.modules.dataprocessing.contdet_amendmask.FindContinuumResult;
import io.github.findcont.modules.dataprocessing.contdet_amendmask.ImageStatisticsProvider;
import io.github.findcont.modules.dataprocessing.contdet_amendmask.MaskAmendmentStateMachine;
import io.github.findcont.modules.dataprocessing.contdet_amendmask.MaskGrowthCollaborator;
import io.github.findcont.modules.dataprocessing.contdet_amendmask.SpectrumSynthesisCollaborator;
import io.github.findcont.modules.dataprocessing.contdet_sigma.SigmaAdjuster;
import io.github.findcont.modules.dataprocessing.contdet_sigma.SigmaAdjustment;
import io.github.findcont.modules.dataprocessing.contdet_sigma.SigmaDefaults;
import io.github.findcont.parameters.ParameterSet;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Entry point of the continuum finder.
 */
public class FindContinuumModule {

  private static final Logger logger = Logger.getLogger(FindContinuumModule.class.getName());

  private static final String MODULE_NAME = "Find continuum";
  private static final String DESCRIPTION = "Selects the line free channels of a spectral line cube from its mean spectrum.";

  public @NotNull String getName() {
    return MODULE_NAME;
  }

  public @NotNull String getDescription() {
    return DESCRIPTION;
  }

  public @NotNull Class<? extends ParameterSet> getParameterSetClass() {
    return FindContinuumParameters.class;
  }

  /**
   * @return the regime default with automatic sigma, the configured sigma otherwise
   */
  public static double initialSigma(@NotNull ParameterSet parameters,
      @NotNull SpectralSetup setup) {
    if (parameters.getValue(FindContinuumParameters.autoSigma)) {
      return SigmaDefaults.initialSigma(
          parameters.getValue(FindContinuumParameters.meanSpectrumMethod), setup.tdm());
    }
    return parameters.getValue(FindContinuumParameters.sigmaFindContinuum);
  }

  /**
   * Full run with mask amendment.
   *
   * @param mask           initial joint mask
   * @param goodAtmosphere atmospheric transmission is good at the observed frequencies
   * @throws IllegalArgumentException for invalid parameters or a spectrum that does not match the
   *                                  spectral setup
   */
  public <M> @NotNull FindContinuumResult runModule(@NotNull ParameterSet parameters,
      @NotNull Spectrum spectrum, @NotNull SpectralSetup setup, @NotNull M mask,
      boolean goodAtmosphere, @NotNull ImageStatisticsProvider<M> imageStatistics,
      @NotNull MaskGrowthCollaborator<M> maskGrowth,
      @NotNull SpectrumSynthesisCollaborator<M> spectrumSynthesis) {
    validate(parameters, spectrum, setup);
    final double sigma = initialSigma(parameters, setup);
    logger.info(() -> "Finding continuum in %d channels (%s), starting sigma %.2f".formatted(
        spectrum.getNumberOfChannels(), setup.tdm() ? "TDM" : "FDM", sigma));
    final MaskAmendmentStateMachine<M> stateMachine = new MaskAmendmentStateMachine<>(parameters,
        new SigmaAdjuster(parameters), imageStatistics, maskGrowth, spectrumSynthesis);
    final FindContinuumResult result = stateMachine.run(spectrum, setup, mask, sigma,
        goodAtmosphere);
    logger.info(() -> "Continuum channels %s (sigma=%.2f, stages %s)".formatted(
        result.getSelectionString(), result.finalSigma(), result.getStageNames()));
    return result;
  }

  /**
   * Single stage without image collaborators: baseline statistics, classification and sigma
   * adjustment of one spectrum.
   */
  public @NotNull SigmaAdjustment findContinuumChannels(@NotNull ParameterSet parameters,
      @NotNull Spectrum spectrum, @NotNull SpectralSetup setup) {
    validate(parameters, spectrum, setup);
    return new SigmaAdjuster(parameters).adjust(spectrum, setup, initialSigma(parameters, setup),
        false);
  }

  private static void validate(ParameterSet parameters, Spectrum spectrum, SpectralSetup setup) {
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      throw new IllegalArgumentException("Invalid parameters: " + String.join("; ", errors));
    }
    if (setup.numberOfChannels() != spectrum.getNumberOfChannels()) {
      throw new IllegalArgumentException(
          "Spectral setup has %d channels, the spectrum %d".formatted(setup.numberOfChannels(),
              spectrum.getNumberOfChannels()));
    }
  }
}
