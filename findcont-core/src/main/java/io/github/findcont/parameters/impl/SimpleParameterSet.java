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

package io.github.findcont.parameters.impl;

import io.github.findcont.parameters.Parameter;
import io.github.findcont.parameters.ParameterSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;

/**
 * Holds independent clones of the parameters it was created with, so that several sets (and the
 * static constants themselves) never share values.
 */
public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Parameter<?>[] parameters;

  public SimpleParameterSet(Parameter<?>... parameters) {
    this.parameters = new Parameter<?>[parameters.length];
    for (int i = 0; i < parameters.length; i++) {
      this.parameters[i] = parameters[i].cloneParameter();
    }
  }

  @Override
  public @NotNull Parameter<?>[] getParameters() {
    return parameters;
  }

  @Override
  @SuppressWarnings("unchecked")
  public @NotNull <T extends Parameter<?>> T getParameter(@NotNull T parameter) {
    for (Parameter<?> p : parameters) {
      if (p.getName().equals(parameter.getName())) {
        return (T) p;
      }
    }
    throw new IllegalArgumentException(
        "Parameter " + parameter.getName() + " does not exist in " + getClass().getSimpleName());
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allOk = true;
    for (Parameter<?> p : parameters) {
      allOk &= p.checkValue(errorMessages);
    }
    if (!allOk) {
      logger.fine(() -> "Invalid parameters: " + errorMessages);
    }
    return allOk;
  }

  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    try {
      final SimpleParameterSet clone = getClass().getDeclaredConstructor().newInstance();
      for (int i = 0; i < parameters.length; i++) {
        copyValue(parameters[i], clone.parameters[i]);
      }
      return clone;
    } catch (ReflectiveOperationException e) {
      // subclasses without a no-arg constructor still clone their values
      final Parameter<?>[] copies = new Parameter<?>[parameters.length];
      for (int i = 0; i < parameters.length; i++) {
        copies[i] = parameters[i].cloneParameter();
      }
      return new SimpleParameterSet(copies);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> void copyValue(Parameter<T> from, Parameter<?> to) {
    ((Parameter<T>) to).setValue(from.getValue());
  }

  @Override
  public String toString() {
    return Arrays.stream(parameters).map(p -> p.getName() + "=" + p.getValue())
        .collect(Collectors.joining(", ", getClass().getSimpleName() + "[", "]"));
  }
}
