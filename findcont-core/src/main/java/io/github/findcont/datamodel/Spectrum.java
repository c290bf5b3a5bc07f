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

package io.github.findcont.datamodel;

import java.util.Arrays;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Intensity per channel of a spectral-line cube, plus the channels that are permanently invalid
 * (flagged or non-finite). Immutable.
 */
public final class Spectrum {

  private final double[] values;
  private final boolean[] flagged;
  private final int[] validChannels;

  /**
   * @param values  one intensity per channel
   * @param flagged true marks an invalid channel; null flags nothing. Non-finite values are
   *                always flagged.
   */
  public Spectrum(@NotNull double[] values, @Nullable boolean[] flagged) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Spectrum has no channels");
    }
    if (flagged != null && flagged.length != values.length) {
      throw new IllegalArgumentException(
          "Channel mask length " + flagged.length + " != spectrum length " + values.length);
    }
    this.values = values.clone();
    this.flagged = new boolean[values.length];
    for (int i = 0; i < values.length; i++) {
      this.flagged[i] = (flagged != null && flagged[i]) || !Double.isFinite(values[i]);
    }
    this.validChannels = IntStream.range(0, values.length).filter(i -> !this.flagged[i])
        .toArray();
    if (validChannels.length == 0) {
      throw new IllegalArgumentException("Spectrum has no valid channels");
    }
  }

  public static Spectrum of(double... values) {
    return new Spectrum(values, null);
  }

  /**
   * @return a spectrum with the same flags and new values
   */
  public Spectrum withValues(@NotNull double[] newValues) {
    if (newValues.length != values.length) {
      throw new IllegalArgumentException("Length mismatch " + newValues.length);
    }
    return new Spectrum(newValues, flagged);
  }

  public int getNumberOfChannels() {
    return values.length;
  }

  public double getValue(int channel) {
    return values[channel];
  }

  public boolean isValid(int channel) {
    return !flagged[channel];
  }

  public double[] getValues() {
    return values.clone();
  }

  public int getNumberOfValidChannels() {
    return validChannels.length;
  }

  public int[] getValidChannels() {
    return validChannels.clone();
  }

  public double[] getValidValues() {
    final double[] v = new double[validChannels.length];
    for (int i = 0; i < v.length; i++) {
      v[i] = values[validChannels[i]];
    }
    return v;
  }

  public double[] getValues(@NotNull int[] channels) {
    final double[] v = new double[channels.length];
    for (int i = 0; i < channels.length; i++) {
      v[i] = values[channels[i]];
    }
    return v;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Spectrum that)) {
      return false;
    }
    return Arrays.equals(values, that.values) && Arrays.equals(flagged, that.flagged);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + Arrays.hashCode(flagged);
  }

  @Override
  public String toString() {
    return "Spectrum[" + values.length + " channels, " + validChannels.length + " valid]";
  }
}
