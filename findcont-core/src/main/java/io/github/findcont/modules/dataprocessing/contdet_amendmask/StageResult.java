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
import io.github.findcont.datamodel.diagnostics.StageDiagnostics;
import io.github.findcont.modules.dataprocessing.contdet_classifier.ChannelClassification;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One executed stage.
 *
 * @param stage          stage name
 * @param selection      continuum of the stage, after intersection with the previous stage
 * @param classification final classifier pass of the stage
 * @param diagnostics    image statistics of the selection, null if unavailable
 * @param transition     what followed the stage
 */
public record StageResult(@NotNull IterationStage stage, @NotNull ChannelSelection selection,
                          @NotNull ChannelClassification classification,
                          @Nullable StageDiagnostics diagnostics,
                          @NotNull StageTransition transition) {

  public double sigma() {
    return classification.sigma();
  }

  public @NotNull Decision decision() {
    return transition.decision();
  }

  public StageResult withTransition(@NotNull StageTransition newTransition) {
    return new StageResult(stage, selection, classification, diagnostics, newTransition);
  }
}
