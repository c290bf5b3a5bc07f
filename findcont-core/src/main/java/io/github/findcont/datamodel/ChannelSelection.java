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

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * Sorted, pairwise disjoint and non-adjacent closed channel ranges, written as
 * {@code "lo1~hi1;lo2~hi2"}. Immutable.
 */
public final class ChannelSelection {

  public static final String DEFAULT_SEPARATOR = ";";
  private static final ChannelSelection EMPTY = new ChannelSelection(ImmutableList.of());

  private final ImmutableList<Range<Integer>> ranges;

  private ChannelSelection(ImmutableList<Range<Integer>> ranges) {
    this.ranges = ranges;
  }

  public static ChannelSelection empty() {
    return EMPTY;
  }

  /**
   * @param ranges closed ranges, sorted ascending and not touching each other
   * @throws IllegalArgumentException if the ranges violate the invariant
   */
  public static ChannelSelection of(@NotNull Collection<Range<Integer>> ranges) {
    int previousUpper = Integer.MIN_VALUE;
    boolean first = true;
    for (Range<Integer> r : ranges) {
      if (!r.hasLowerBound() || !r.hasUpperBound()) {
        throw new IllegalArgumentException("Unbounded channel range " + r);
      }
      final Range<Integer> c = closed(r);
      if (c.lowerEndpoint() < 0 || c.lowerEndpoint() > c.upperEndpoint()) {
        throw new IllegalArgumentException("Invalid channel range " + r);
      }
      if (!first && c.lowerEndpoint() <= previousUpper + 1) {
        throw new IllegalArgumentException("Channel ranges not sorted and disjoint at " + r);
      }
      previousUpper = c.upperEndpoint();
      first = false;
    }
    return ranges.isEmpty() ? EMPTY
        : new ChannelSelection(ranges.stream().map(ChannelSelection::closed)
            .collect(ImmutableList.toImmutableList()));
  }

  public static ChannelSelection of(int lo, int hi) {
    return of(List.of(Range.closed(lo, hi)));
  }

  /**
   * @param channels channel indices in any order, duplicates allowed
   */
  public static ChannelSelection fromChannels(@NotNull int[] channels) {
    final RangeSet<Integer> set = TreeRangeSet.create();
    for (int c : channels) {
      set.add(Range.closed(c, c).canonical(DiscreteDomain.integers()));
    }
    return fromRangeSet(set);
  }

  public static ChannelSelection fromChannels(@NotNull Collection<Integer> channels) {
    return fromChannels(channels.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Parses {@code "5~20;30~40"}. Single channels may be written without {@code ~}.
   */
  public static ChannelSelection parse(@NotNull String selection, @NotNull String separator) {
    final String trimmed = selection.trim();
    if (trimmed.isEmpty()) {
      return EMPTY;
    }
    final RangeSet<Integer> set = TreeRangeSet.create();
    for (String token : trimmed.split(Pattern.quote(separator))) {
      final String[] bounds = token.trim().split("~");
      try {
        final int lo = Integer.parseInt(bounds[0].trim());
        final int hi = bounds.length > 1 ? Integer.parseInt(bounds[1].trim()) : lo;
        if (bounds.length > 2 || lo > hi || lo < 0) {
          throw new IllegalArgumentException("Invalid channel range '" + token + "'");
        }
        set.add(Range.closed(lo, hi).canonical(DiscreteDomain.integers()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid channel range '" + token + "'", e);
      }
    }
    return fromRangeSet(set);
  }

  public static ChannelSelection parse(@NotNull String selection) {
    return parse(selection, DEFAULT_SEPARATOR);
  }

  private static ChannelSelection fromRangeSet(RangeSet<Integer> set) {
    final List<Range<Integer>> closed = new ArrayList<>();
    for (Range<Integer> r : set.asRanges()) {
      closed.add(closed(r));
    }
    return closed.isEmpty() ? EMPTY : new ChannelSelection(ImmutableList.copyOf(closed));
  }

  private static Range<Integer> closed(Range<Integer> r) {
    final Range<Integer> c = r.canonical(DiscreteDomain.integers());
    return Range.closed(c.lowerEndpoint(), c.upperEndpoint() - 1);
  }

  private RangeSet<Integer> toRangeSet() {
    final RangeSet<Integer> set = TreeRangeSet.create();
    for (Range<Integer> r : ranges) {
      set.add(r.canonical(DiscreteDomain.integers()));
    }
    return set;
  }

  /**
   * @return channels contained in both selections
   */
  public ChannelSelection intersect(@NotNull ChannelSelection other) {
    return fromRangeSet(ImmutableRangeSet.copyOf(toRangeSet()).intersection(other.toRangeSet()));
  }

  public ChannelSelection union(@NotNull ChannelSelection other) {
    final RangeSet<Integer> set = toRangeSet();
    set.addAll(other.toRangeSet());
    return fromRangeSet(set);
  }

  /**
   * @return channels in [0, numberOfChannels) not contained in this selection
   */
  public ChannelSelection complement(int numberOfChannels) {
    if (numberOfChannels <= 0) {
      return EMPTY;
    }
    final RangeSet<Integer> set = TreeRangeSet.create();
    set.add(Range.closedOpen(0, numberOfChannels));
    set.removeAll(toRangeSet());
    return fromRangeSet(set);
  }

  public @NotNull List<Range<Integer>> getRanges() {
    return ranges;
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  public int getNumberOfRanges() {
    return ranges.size();
  }

  public int getChannelCount() {
    int count = 0;
    for (Range<Integer> r : ranges) {
      count += width(r);
    }
    return count;
  }

  public int getLargestRangeWidth() {
    return ranges.stream().mapToInt(ChannelSelection::width).max().orElse(0);
  }

  public int getSmallestRangeWidth() {
    return ranges.stream().mapToInt(ChannelSelection::width).min().orElse(0);
  }

  /**
   * @throws NoSuchElementException if empty
   */
  public int getFirstChannel() {
    if (isEmpty()) {
      throw new NoSuchElementException("Empty selection");
    }
    return ranges.get(0).lowerEndpoint();
  }

  /**
   * @throws NoSuchElementException if empty
   */
  public int getLastChannel() {
    if (isEmpty()) {
      throw new NoSuchElementException("Empty selection");
    }
    return ranges.get(ranges.size() - 1).upperEndpoint();
  }

  public boolean contains(int channel) {
    for (Range<Integer> r : ranges) {
      if (r.contains(channel)) {
        return true;
      }
    }
    return false;
  }

  public int[] toChannelArray() {
    final int[] channels = new int[getChannelCount()];
    int i = 0;
    for (Range<Integer> r : ranges) {
      for (int c = r.lowerEndpoint(); c <= r.upperEndpoint(); c++) {
        channels[i++] = c;
      }
    }
    return channels;
  }

  /**
   * @return aggregate bandwidth in the unit of the channel width
   */
  public double getBandwidth(double channelWidth) {
    return getChannelCount() * Math.abs(channelWidth);
  }

  public String toSelectionString(@NotNull String separator) {
    return ranges.stream().map(r -> r.lowerEndpoint() + "~" + r.upperEndpoint())
        .collect(Collectors.joining(separator));
  }

  public String toSelectionString() {
    return toSelectionString(DEFAULT_SEPARATOR);
  }

  private static int width(Range<Integer> r) {
    return r.upperEndpoint() - r.lowerEndpoint() + 1;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ChannelSelection that && ranges.equals(that.ranges));
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public String toString() {
    return toSelectionString();
  }
}
