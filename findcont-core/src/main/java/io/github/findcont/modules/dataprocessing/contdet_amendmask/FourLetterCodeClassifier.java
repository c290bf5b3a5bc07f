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
import org.jetbrains.annotations.NotNull;

/**
 * Compares two snapshots of the same derived image.
 */
public class FourLetterCodeClassifier {

  private final double threshold;

  /**
   * @param threshold relative change that still counts as the same, twice that for the MAD
   */
  public FourLetterCodeClassifier(double threshold) {
    if (threshold < 0) {
      throw new IllegalArgumentException("threshold must be >= 0");
    }
    this.threshold = threshold;
  }

  public @NotNull FourLetterCode compute(@NotNull MapDiagnostics before,
      @NotNull MapDiagnostics after) {
    final char[] code = new char[]{
        letter(before.peakInside(), after.peakInside(), threshold),
        letter(before.peakOutside(), after.peakOutside(), threshold),
        letter(before.pixelSum(), after.pixelSum(), threshold),
        letter(before.scaledMAD(), after.scaledMAD(), 2 * threshold)};
    return new FourLetterCode(new String(code));
  }

  static double relativeChange(double before, double after) {
    if (before == after) {
      return 0d;
    }
    if (before == 0) {
      return Math.signum(after) * Double.POSITIVE_INFINITY;
    }
    return (after - before) / Math.abs(before);
  }

  private static char letter(double before, double after, double threshold) {
    final double change = relativeChange(before, after);
    if (change > threshold) {
      return 'H';
    }
    if (change < -threshold) {
      return 'L';
    }
    return 'S';
  }
}
