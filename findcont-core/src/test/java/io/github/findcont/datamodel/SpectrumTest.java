/*
 * Copyright (c) 2025 The findcont Development Team
 */

package io.github.findcont.datamodel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpectrumTest {

  @Test
  void testEmptySpectrumIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> Spectrum.of());
  }

  @Test
  void testAllChannelsInvalidIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> Spectrum.of(Double.NaN, Double.NaN));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Spectrum(new double[]{1, 2}, new boolean[]{true, true}));
  }

  @Test
  void testMaskLengthMismatchIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Spectrum(new double[]{1, 2, 3}, new boolean[]{false}));
  }

  @Test
  void testNonFiniteValuesAreFlagged() {
    Spectrum spectrum = new Spectrum(new double[]{1, Double.NaN, 3, 4},
        new boolean[]{false, false, false, true});
    Assertions.assertEquals(4, spectrum.getNumberOfChannels());
    Assertions.assertEquals(2, spectrum.getNumberOfValidChannels());
    Assertions.assertArrayEquals(new int[]{0, 2}, spectrum.getValidChannels());
    Assertions.assertArrayEquals(new double[]{1, 3}, spectrum.getValidValues());
    Assertions.assertFalse(spectrum.isValid(1));
  }

  @Test
  void testWithValuesKeepsFlags() {
    Spectrum spectrum = new Spectrum(new double[]{1, 2, 3}, new boolean[]{false, true, false});
    Spectrum changed = spectrum.withValues(new double[]{4, 5, 6});
    Assertions.assertFalse(changed.isValid(1));
    Assertions.assertEquals(6, changed.getValue(2));
  }
}
