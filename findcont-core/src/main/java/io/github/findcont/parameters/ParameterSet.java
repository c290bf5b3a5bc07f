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

package io.github.findcont.parameters;

import java.util.Collection;
import org.jetbrains.annotations.NotNull;

public interface ParameterSet {

  @NotNull Parameter<?>[] getParameters();

  /**
   * @param parameter the static parameter constant used as key
   * @return the instance held by this set
   */
  @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter);

  default <T> T getValue(@NotNull Parameter<T> parameter) {
    return getParameter(parameter).getValue();
  }

  default <T> void setParameter(@NotNull Parameter<T> parameter, T value) {
    getParameter(parameter).setValue(value);
  }

  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();
}
