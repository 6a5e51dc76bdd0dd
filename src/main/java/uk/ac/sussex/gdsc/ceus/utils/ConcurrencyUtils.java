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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.UncheckedExecutionException;
import ij.Prefs;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

/**
 * Runs indexed work on a fixed thread pool.
 *
 * <p>Each task must write only to its own output slot. The pool is created per call and shut down
 * when all tasks are complete.
 */
public final class ConcurrencyUtils {

  /** No public construction. */
  private ConcurrencyUtils() {}

  /**
   * Gets the number of threads to use. Non-positive values use the ImageJ preference.
   *
   * @param threads the requested threads
   * @return the threads
   */
  public static int getThreads(int threads) {
    return threads > 0 ? threads : Math.max(1, Prefs.getThreads());
  }

  /**
   * Invoke the action for each index in {@code [0, size)}.
   *
   * @param threads the number of threads
   * @param size the number of tasks
   * @param action the action
   */
  public static void forEach(int threads, int size, IntConsumer action) {
    final int threadCount = Math.min(getThreads(threads), size);
    if (threadCount <= 1) {
      for (int i = 0; i < size; i++) {
        action.accept(i);
      }
      return;
    }
    final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    try {
      final List<Future<?>> futures = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        final int index = i;
        futures.add(executor.submit(() -> action.accept(index)));
      }
      futures.forEach(ConcurrencyUtils::join);
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Invoke all the tasks and collect the results in task order.
   *
   * @param <T> the result type
   * @param threads the number of threads
   * @param tasks the tasks
   * @return the results
   */
  public static <T> List<T> invokeAll(int threads, List<? extends Callable<T>> tasks) {
    final int threadCount = Math.min(getThreads(threads), tasks.size());
    final List<T> results = new ArrayList<>(tasks.size());
    if (threadCount <= 1) {
      for (final Callable<T> task : tasks) {
        results.add(call(task));
      }
      return results;
    }
    final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    try {
      final List<Future<T>> futures = new ArrayList<>(tasks.size());
      for (final Callable<T> task : tasks) {
        futures.add(executor.submit(task));
      }
      for (final Future<T> future : futures) {
        results.add(join(future));
      }
    } finally {
      executor.shutdown();
    }
    return results;
  }

  private static <T> T call(Callable<T> task) {
    try {
      return task.call();
    } catch (final RuntimeException ex) {
      throw ex;
    } catch (final Exception ex) {
      throw new UncheckedExecutionException(ex);
    }
  }

  /**
   * Wait for the future and return the result. Runtime failures of the task are rethrown
   * unwrapped.
   *
   * @param <T> the result type
   * @param future the future
   * @return the result
   */
  private static <T> T join(Future<T> future) {
    try {
      return Futures.getUnchecked(future);
    } catch (final UncheckedExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw ex;
    }
  }
}
