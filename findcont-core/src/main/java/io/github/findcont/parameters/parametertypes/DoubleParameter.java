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

package io.github.findcont.parameters.parametertypes;

import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DoubleParameter extends AbstractParameter<Double> {

  private final NumberFormat format;
  private final double minimum;
  private final double maximum;

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue) {
    this(name, description, format, defaultValue, -Double.MAX_VALUE, Double.MAX_VALUE);
  }

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @Nullable Double defaultValue, double minimum, double maximum) {
    super(name, description, defaultValue);
    this.format = format;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  public NumberFormat getFormat() {
    return format;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (!super.checkValue(errorMessages)) {
      return false;
    }
    if (value.isNaN() || value < minimum || value > maximum) {
      errorMessages.add(
          name + " must be within [" + format.format(minimum) + ", " + format.format(maximum)
              + "] but is " + format.format(value));
      return false;
    }
    return true;
  }

  @Override
  public @NotNull DoubleParameter cloneParameter() {
    return new DoubleParameter(name, description, format, value, minimum, maximum);
  }
}
