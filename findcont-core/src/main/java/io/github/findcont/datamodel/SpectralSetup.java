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

/**
 * Spectral window properties that tune the defaults. A channel width or first frequency of 0
 * means unknown.
 *
 * @param numberOfChannels channels in the spectral window
 * @param channelWidthHz   channel width in Hz
 * @param firstFrequencyHz frequency of the first channel in Hz
 * @param tdm              true for a coarse (TDM-like) spectral setup
 */
public record SpectralSetup(int numberOfChannels, double channelWidthHz, double firstFrequencyHz,
                            boolean tdm) {

  /**
   * Bandwidth that tempers sigma reductions, a full ALMA baseband.
   */
  public static final double REFERENCE_BANDWIDTH_HZ = 1.875e9;

  public SpectralSetup {
    if (numberOfChannels <= 0) {
      throw new IllegalArgumentException("numberOfChannels must be positive");
    }
  }

  public static SpectralSetup of(int numberOfChannels, double channelWidthHz,
      double firstFrequencyHz) {
    return new SpectralSetup(numberOfChannels, channelWidthHz, firstFrequencyHz,
        isTdm(Math.abs(channelWidthHz), numberOfChannels));
  }

  public static SpectralSetup unknownFrequencies(int numberOfChannels, boolean tdm) {
    return new SpectralSetup(numberOfChannels, 0d, 0d, tdm);
  }

  /**
   * 15 MHz instead of 15.625 MHz because LSRK channels can be slightly narrower than TOPO ones.
   * Wide single-polarization TDM has 7.8 MHz channels and more than 240 of them.
   */
  public static boolean isTdm(double channelWidthHz, int numberOfChannels) {
    return (channelWidthHz >= 15e6 / 2 && numberOfChannels > 240) || channelWidthHz >= 15e6;
  }

  public double bandwidthHz() {
    return numberOfChannels * Math.abs(channelWidthHz);
  }

  public boolean hasChannelWidth() {
    return channelWidthHz != 0d;
  }
}
