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

package io.github.findcont.util;

import io.github.findcont.datamodel.Spectrum;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;

/**
 * Helpers on sorted channel index arrays.
 */
public final class ChannelGroupUtils {

  private ChannelGroupUtils() {
  }

  /**
   * [1,2,3,5,6,7] -> [[1,2,3],[5,6,7]]
   *
   * @param channels sorted ascending
   */
  public static List<int[]> splitIntoContiguousGroups(@NotNull int[] channels) {
    final List<int[]> groups = new ArrayList<>();
    if (channels.length == 0) {
      return groups;
    }
    int start = 0;
    for (int i = 1; i < channels.length; i++) {
      if (channels[i - 1] != channels[i] - 1) {
        groups.add(Arrays.copyOfRange(channels, start, i));
        start = i;
      }
    }
    groups.add(Arrays.copyOfRange(channels, start, channels.length));
    return groups;
  }

  public static int[] flatten(@NotNull List<int[]> groups) {
    return groups.stream().flatMapToInt(IntStream::of).toArray();
  }

  public static int totalLength(@NotNull List<int[]> groups) {
    return groups.stream().mapToInt(g -> g.length).sum();
  }

  public static int maxLength(@NotNull List<int[]> groups) {
    return groups.stream().mapToInt(g -> g.length).max().orElse(0);
  }

  /**
   * Number of channels at each end of the spectrum that repeat the first (or last) valid value,
   * the signature of flagged or padded band edges. A run of one channel is no repeat and counts 0.
   *
   * @return {leading, trailing}
   */
  public static int[] edgeRunLengths(@NotNull Spectrum spectrum) {
    final int[] valid = spectrum.getValidChannels();
    if (valid.length < 3) {
      return new int[]{0, 0};
    }
    int lead = 1;
    final double first = spectrum.getValue(valid[0]);
    while (lead < valid.length && spectrum.getValue(valid[lead]) == first) {
      lead++;
    }
    int trail = 1;
    final double last = spectrum.getValue(valid[valid.length - 1]);
    while (trail < valid.length && spectrum.getValue(valid[valid.length - 1 - trail]) == last) {
      trail++;
    }
    if (lead >= valid.length) {
      // constant spectrum, nothing would remain
      return new int[]{0, 0};
    }
    return new int[]{lead > 1 ? lead : 0, trail > 1 ? trail : 0};
  }

  /**
   * @return valid channels without the repeated runs at the spectrum edges
   */
  public static int[] validChannelsWithoutEdgeRuns(@NotNull Spectrum spectrum) {
    final int[] valid = spectrum.getValidChannels();
    final int[] runs = edgeRunLengths(spectrum);
    if (runs[0] + runs[1] >= valid.length) {
      return valid;
    }
    return Arrays.copyOfRange(valid, runs[0], valid.length - runs[1]);
  }
}
