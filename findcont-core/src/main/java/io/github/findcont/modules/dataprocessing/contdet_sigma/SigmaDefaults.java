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

package io.github.findcont.modules.dataprocessing.contdet_sigma;

import io.github.findcont.modules.dataprocessing.findcont.FindContinuumParameters.MeanSpectrumMethod;
import org.jetbrains.annotations.NotNull;

/**
 * Starting sigma per spectral regime.
 */
public final class SigmaDefaults {

  public static final double TDM_MEAN_ABOVE_THRESHOLD = 4.5;
  public static final double TDM_PEAK_OVER_MAD = 6.5;
  public static final double FDM_MEAN_ABOVE_THRESHOLD = 3.5;
  public static final double FDM_PEAK_OVER_MAD = 6.0;

  private SigmaDefaults() {
  }

  /**
   * Sigma of coarse spectral setups. Below it, single channel noise spikes may raise sigma.
   */
  public static double tdmSigma(@NotNull MeanSpectrumMethod method) {
    return method == MeanSpectrumMethod.PEAK_OVER_MAD ? TDM_PEAK_OVER_MAD
        : TDM_MEAN_ABOVE_THRESHOLD;
  }

  public static double initialSigma(@NotNull MeanSpectrumMethod method, boolean tdm) {
    if (tdm) {
      return tdmSigma(method);
    }
    return method == MeanSpectrumMethod.PEAK_OVER_MAD ? FDM_PEAK_OVER_MAD
        : FDM_MEAN_ABOVE_THRESHOLD;
  }
}
