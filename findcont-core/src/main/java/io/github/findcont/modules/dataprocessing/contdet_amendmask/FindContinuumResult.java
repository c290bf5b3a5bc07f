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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.findcont.datamodel.ChannelSelection;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a continuum finding run.
 *
 * @param selection          final continuum channels
 * @param finalSigma         sigma of the stage the selection comes from
 * @param stages             executed stages in order, ORIGINAL first
 * @param droppedRangeCount  narrow ranges dropped in the accepted stage
 * @param warnings           warnings on the final selection
 * @param revertedToOriginal the amendment made the difference map worse and was discarded
 * @param appendedRange      a range of baseline channels was appended to widen the selection
 * @param finalCode          difference map code of the final stage against ORIGINAL, null if no
 *                           amendment stage ran
 */
public record FindContinuumResult(@NotNull ChannelSelection selection, double finalSigma,
                                  @NotNull List<StageResult> stages, int droppedRangeCount,
                                  @NotNull Set<ContinuumWarning> warnings,
                                  boolean revertedToOriginal, boolean appendedRange,
                                  @Nullable FourLetterCode finalCode) {

  public FindContinuumResult {
    stages = ImmutableList.copyOf(stages);
    warnings = ImmutableSet.copyOf(warnings);
  }

  public String getSelectionString() {
    return selection.toSelectionString();
  }

  public List<IterationStage> getStageNames() {
    return stages.stream().map(StageResult::stage).toList();
  }

  public boolean hasWarning(@NotNull ContinuumWarning warning) {
    return warnings.contains(warning);
  }
}
