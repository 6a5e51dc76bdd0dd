/*-
 * #%L
 * Genome Damage and Stability Centre CEUS Perfusion Analysis
 *
 * Software for contrast-enhanced ultrasound perfusion analysis
 * %%
 * Copyright (C) 2020 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.ceus.utils;

import com.google.common.util.concurrent.UncheckedExecutionException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicIntegerArray;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ConcurrencyUtilsTest {
  @Test
  void testGetThreads() {
    Assertions.assertEquals(3, ConcurrencyUtils.getThreads(3));
    Assertions.assertTrue(ConcurrencyUtils.getThreads(0) >= 1);
  }

  @Test
  void testForEachVisitsAllIndices() {
    for (final int threads : new int[] {1, 4}) {
      final AtomicIntegerArray counts = new AtomicIntegerArray(50);
      ConcurrencyUtils.forEach(threads, counts.length(), counts::incrementAndGet);
      for (int i = 0; i < counts.length(); i++) {
        Assertions.assertEquals(1, counts.get(i));
      }
    }
  }

  @Test
  void testInvokeAllKeepsOrder() {
    final List<Callable<Integer>> tasks = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      final int value = i;
      tasks.add(() -> {
        Thread.sleep((20 - value) % 3);
        return value * value;
      });
    }
    for (final int threads : new int[] {1, 3}) {
      final List<Integer> results = ConcurrencyUtils.invokeAll(threads, tasks);
      for (int i = 0; i < 20; i++) {
        Assertions.assertEquals(i * i, results.get(i).intValue());
      }
    }
  }

  @Test
  void testFailuresArePropagated() {
    for (final int threads : new int[] {1, 2}) {
      Assertions.assertThrows(IllegalStateException.class,
          () -> ConcurrencyUtils.forEach(threads, 4, i -> {
            if (i == 2) {
              throw new IllegalStateException("bad");
            }
          }));
      final List<Callable<Integer>> tasks = new ArrayList<>();
      tasks.add(() -> 1);
      tasks.add(() -> {
        throw new IOException("io");
      });
      Assertions.assertThrows(UncheckedExecutionException.class,
          () -> ConcurrencyUtils.invokeAll(threads, tasks));
    }
  }
}
