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

import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/**
 * One of H (higher), L (lower) or S (same) for peak inside the mask, peak outside the mask,
 * pixel sum and scaled MAD, in this order.
 */
public record FourLetterCode(@NotNull String code) {

  private static final Pattern VALID = Pattern.compile("[HLS]{4}");

  public static final FourLetterCode SAME = new FourLetterCode("SSSS");

  /**
   * Codes of a difference map that got worse in every aspect.
   */
  public static final ImmutableSet<FourLetterCode> ALL_WORSE = ImmutableSet.of(
      new FourLetterCode("HHHH"), new FourLetterCode("HHHS"));

  public FourLetterCode {
    if (!VALID.matcher(code).matches()) {
      throw new IllegalArgumentException("Not a four letter code over H, L and S: " + code);
    }
  }

  public boolean isAllWorse() {
    return ALL_WORSE.contains(this);
  }

  public int count(char letter) {
    return (int) code.chars().filter(c -> c == letter).count();
  }

  /**
   * @return true if more dimensions got higher than lower
   */
  public boolean isMostlyHigher() {
    return count('H') > count('L');
  }

  @Override
  public String toString() {
    return code;
  }
}
