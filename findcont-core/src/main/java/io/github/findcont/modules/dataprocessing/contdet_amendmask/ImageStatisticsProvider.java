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

import io.github.findcont.datamodel.ChannelSelection;
import io.github.findcont.datamodel.diagnostics.MapType;
import io.github.findcont.datamodel.diagnostics.StageDiagnostics;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Builds the derived images of a channel selection and measures them. Implementations wrap the
 * image processing package in use, the continuum finder never touches pixels itself.
 *
 * @param <M> joint mask type of the implementation
 */
public interface ImageStatisticsProvider<M> {

  /**
   * @param continuum selected continuum channels
   * @param mask      joint mask of the stage
   * @return statistics of the signal and difference maps, null if they cannot be computed
   */
  @Nullable
  StageDiagnostics measure(@NotNull ChannelSelection continuum, @NotNull M mask);

  /**
   * @param above count pixels above the level if true, below it otherwise
   * @return pixel count, negative if unknown
   */
  long countPixels(@NotNull ChannelSelection continuum, @NotNull M mask, @NotNull MapType map,
      double level, boolean above);
}
