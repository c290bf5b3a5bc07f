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

/**
 * @param kind      outcome
 * @param level     intensity above which pixels are significant, NaN if not evaluated
 * @param sigmaUsed significance in scaled MADs that defined the level, NaN if not evaluated
 */
public record Decision(@NotNull DecisionKind kind, double level, double sigmaUsed) {

  /**
   * Decision for missing or unusable diagnostics.
   */
  public static Decision missing() {
    return new Decision(DecisionKind.NO, Double.NaN, Double.NaN);
  }

  public static Decision noImprovement(double sigmaUsed) {
    return new Decision(DecisionKind.NO_IMPROVEMENT, Double.NaN, sigmaUsed);
  }

  public boolean isYes() {
    return kind.isYes();
  }
}
