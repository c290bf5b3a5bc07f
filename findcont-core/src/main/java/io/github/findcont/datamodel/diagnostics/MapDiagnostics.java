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

package io.github.findcont.datamodel.diagnostics;

/**
 * Statistics of one derived image, supplied by the image statistics provider.
 *
 * @param peakInside  peak within the joint mask
 * @param peakOutside peak outside the joint mask
 * @param median      median outside the mask
 * @param scaledMAD   scaled MAD outside the mask
 * @param pixelSum    sum of the pixels above the significance level
 * @param pixelCount  pixels in the statistics population
 */
public record MapDiagnostics(double peakInside, double peakOutside, double median,
                             double scaledMAD, double pixelSum, long pixelCount) {

  public MapDiagnostics {
    if (scaledMAD < 0 || Double.isNaN(scaledMAD)) {
      throw new IllegalArgumentException("scaledMAD must be >= 0 but is " + scaledMAD);
    }
    if (pixelCount < 0) {
      throw new IllegalArgumentException("pixelCount must be >= 0 but is " + pixelCount);
    }
  }

  /**
   * @return (peak outside the mask - median) / scaled MAD, 0 for a flat image
   */
  public double snr() {
    if (scaledMAD == 0) {
      return 0d;
    }
    return (peakOutside - median) / scaledMAD;
  }

  /**
   * @return the intensity sigma scaled MADs above the median
   */
  public double level(double sigma) {
    return median + sigma * scaledMAD;
  }
}
