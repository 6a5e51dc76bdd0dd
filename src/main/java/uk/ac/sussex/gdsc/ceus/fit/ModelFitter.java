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

package uk.ac.sussex.gdsc.ceus.fit;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresFactory;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem.Evaluation;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import uk.ac.sussex.gdsc.ceus.FitDivergedException;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.InsufficientDataException;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;
import uk.ac.sussex.gdsc.ceus.utils.ConcurrencyUtils;
import uk.ac.sussex.gdsc.ceus.utils.MathUtils;

/**
 * Fits perfusion models to a time-intensity curve.
 *
 * <p>Each model is fit by bounded Levenberg-Marquardt least squares from multiple start points.
 * Start 0 is a data-driven seed; the other starts scale each seed parameter by a random factor in
 * [0.5, 1.5). The starts are run in parallel and the fit with the lowest residual sum of squares
 * is selected (ties to the lowest start index). Starts that fail to converge are discarded. A
 * model where all starts fail is reported as missing.
 */
public class ModelFitter {
  private static final Logger logger = Logger.getLogger(ModelFitter.class.getName());

  private static final double LN2 = Math.log(2);
  /** The maximum iterations of each optimisation. */
  private static final int MAX_ITERATIONS = 3000;
  /** The relative change in the cost that stops the optimisation. */
  private static final double COST_RELATIVE_TOLERANCE = 1e-10;

  private final FitOptions options;

  /**
   * The outcome of one start point.
   */
  private static class StartResult {
    final int index;
    final double[] point;
    final double rss;

    StartResult(int index, double[] point, double rss) {
      this.index = index;
      this.point = point;
      this.rss = rss;
    }
  }

  /**
   * Create an instance.
   *
   * @param options the options
   */
  public ModelFitter(FitOptions options) {
    this.options = options.copy();
  }

  /**
   * Fit the models to the included points of the curve.
   *
   * @param curve the curve
   * @param models the models
   * @return the results
   */
  public ModelFitResults fit(TimeIntensityCurve curve, Collection<KineticModel> models) {
    return fit(curve.getIncludedTime(), curve.getIncludedValues(), models);
  }

  /**
   * Fit the models to the data.
   *
   * @param time the time
   * @param values the values
   * @param models the models
   * @return the results
   * @throws InputShapeException if the time and values have different lengths
   */
  public ModelFitResults fit(double[] time, double[] values, Collection<KineticModel> models) {
    if (time.length != values.length) {
      throw new InputShapeException(
          "Time and value lengths differ: " + time.length + " != " + values.length);
    }
    // Draw all the random start points up-front in model order for reproducibility
    final UniformRandomProvider rng = options.getSeed() == null
        ? RandomSource.XO_RO_SHI_RO_128_PP.create()
        : RandomSource.XO_RO_SHI_RO_128_PP.create(options.getSeed());
    final ModelFitResults results = new ModelFitResults();
    for (final KineticModel model : models) {
      try {
        final FitResult result = fitModel(model, time, values, rng);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Fit " + result);
        }
        results.add(result);
      } catch (final InsufficientDataException | FitDivergedException ex) {
        logger.warning(() -> "Failed to fit " + model + ": " + ex.getMessage());
        results.addFailure(model, ex.getMessage());
      }
    }
    return results;
  }

  /**
   * Fit the model.
   *
   * @param model the model
   * @param time the time
   * @param values the values
   * @param rng the source of randomness for the start points
   * @return the result
   * @throws InsufficientDataException if there are too few points
   * @throws FitDivergedException if all start points fail
   */
  FitResult fitModel(KineticModel model, double[] time, double[] values,
      UniformRandomProvider rng) {
    double[] t = time;
    double[] y = values;
    if (!model.isBolus()) {
      final double tmax = options.getWashInMaxTime();
      int n = 0;
      t = new double[time.length];
      y = new double[time.length];
      for (int i = 0; i < time.length; i++) {
        if (time[i] <= tmax) {
          t[n] = time[i];
          y[n] = values[i];
          n++;
        }
      }
      t = Arrays.copyOf(t, n);
      y = Arrays.copyOf(y, n);
    }
    if (t.length < model.getMinimumPoints()) {
      throw InsufficientDataException.of(model + " fit", model.getMinimumPoints(), t.length);
    }

    final double[][] bounds = getBounds(model, t, y);
    final double[] seed = clamp(seed(model, t, y), bounds);
    final List<double[]> starts = createStarts(seed, bounds, options.getRestarts(), rng);

    final PerfusionFunction function = model.createFunction(t);
    final double[] observed = y;
    final List<Callable<StartResult>> tasks = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      final int index = i;
      final double[] start = starts.get(i);
      tasks.add(() -> optimise(function, observed, start, bounds, index));
    }
    StartResult best = null;
    for (final StartResult r : ConcurrencyUtils.invokeAll(options.getThreads(), tasks)) {
      // Results are in start order so a strict comparison keeps the lowest index on ties
      if (r != null && (best == null || r.rss < best.rss)) {
        best = r;
      }
    }
    if (best == null) {
      throw new FitDivergedException(
          model + ": all " + starts.size() + " start points failed to converge");
    }
    return new FitResult(model, function, best.point, best.rss,
        rsquared(best.rss, observed), best.index);
  }

  /**
   * Create the start points. Start 0 is the seed; subsequent starts multiply each parameter by a
   * uniform factor in [0.5, 1.5) and clamp to the bounds.
   *
   * @param seed the seed
   * @param bounds the bounds
   * @param count the number of starts
   * @param rng the source of randomness
   * @return the starts
   */
  @VisibleForTesting
  static List<double[]> createStarts(double[] seed, double[][] bounds, int count,
      UniformRandomProvider rng) {
    final List<double[]> starts = new ArrayList<>(count);
    starts.add(seed.clone());
    for (int s = 1; s < count; s++) {
      final double[] start = new double[seed.length];
      for (int i = 0; i < seed.length; i++) {
        start[i] = seed[i] * (0.5 + rng.nextDouble());
      }
      starts.add(clamp(start, bounds));
    }
    return starts;
  }

  private static StartResult optimise(PerfusionFunction function, double[] y, double[] start,
      double[][] bounds, int index) {
    final double[] lower = bounds[0];
    final double[] upper = bounds[1];
    final ParameterValidator paramValidator = point -> {
      for (int i = point.getDimension(); i-- > 0;) {
        final double v = point.getEntry(i);
        if (v < lower[i]) {
          point.setEntry(i, lower[i]);
        } else if (v > upper[i]) {
          point.setEntry(i, upper[i]);
        }
      }
      return point;
    };
    final RealVector observed = new ArrayRealVector(y, false);
    final double[] weights = new double[y.length];
    Arrays.fill(weights, 1.0);
    final RealMatrix weightMatrix = new DiagonalMatrix(weights, false);
    final int maxEvaluations = Integer.MAX_VALUE;
    final boolean lazyEvaluation = false;

    final ConvergenceChecker<Evaluation> checker = (iteration, previous, current) -> relativeError(
        previous.getCost(), current.getCost()) < COST_RELATIVE_TOLERANCE;

    final LeastSquaresProblem problem = LeastSquaresFactory.create(function, observed,
        new ArrayRealVector(start), weightMatrix, checker, maxEvaluations, MAX_ITERATIONS,
        lazyEvaluation, paramValidator);
    try {
      final Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
      final RealVector residuals = optimum.getResiduals();
      final double rss = residuals.dotProduct(residuals);
      final double[] point = optimum.getPoint().toArray();
      if (!Double.isFinite(rss) || !MathUtils.isFinite(point)) {
        return null;
      }
      return new StartResult(index, point, rss);
    } catch (TooManyIterationsException | ConvergenceException ex) {
      logger.finest(() -> "Start " + index + " failed: " + ex.getMessage());
      return null;
    }
  }

  private static double relativeError(double a, double b) {
    final double max = Math.max(Math.abs(a), Math.abs(b));
    return max == 0 ? 0 : Math.abs(a - b) / max;
  }

  private static double rsquared(double rss, double[] y) {
    double sum = 0;
    for (final double v : y) {
      sum += v;
    }
    final double mean = sum / y.length;
    double tss = 0;
    for (final double v : y) {
      tss += (v - mean) * (v - mean);
    }
    return tss > 0 ? 1 - rss / tss : Double.NaN;
  }

  /**
   * Gets the bounds for the model. User bounds take precedence over the defaults.
   *
   * @param model the model
   * @param t the time
   * @param y the values
   * @return the bounds {lower, upper}
   */
  double[][] getBounds(KineticModel model, double[] t, double[] y) {
    final double[][] user = options.getBounds(model);
    return user != null ? user : getDefaultBounds(model, MathUtils.max(t), MathUtils.max(y));
  }

  /**
   * Gets the default bounds for the model.
   *
   * @param model the model
   * @param tmax the maximum time
   * @param ymax the maximum value
   * @return the bounds {lower, upper}
   */
  public static double[][] getDefaultBounds(KineticModel model, double tmax, double ymax) {
    final double inf = Double.POSITIVE_INFINITY;
    final double cmax = Math.max(ymax, 1);
    switch (model) {
      case LOGNORMAL:
        return new double[][] {{0, 0, 0.01, 0, 0}, {inf, 10, 2, tmax, cmax}};
      case GAMMA_VARIATE:
        return new double[][] {{0, 1e-3, 1e-3, 0, 0}, {inf, 20, 20, tmax, cmax}};
      case LDRW:
      case FPT:
        return new double[][] {{0, 1e-3, 1e-3, 0, 0}, {inf, 100, 20, tmax, cmax}};
      case WASH_IN:
        return new double[][] {{0, 1e-4}, {inf, 5}};
      default:
        throw new IllegalStateException("Unknown model: " + model);
    }
  }

  /**
   * Compute the data-driven seed for the model.
   *
   * @param model the model
   * @param t the time
   * @param y the values
   * @return the seed
   */
  double[] seed(KineticModel model, double[] t, double[] y) {
    final double c = options.getBaselineHint() != null ? options.getBaselineHint()
        : MathUtils.percentile(y, 10);
    if (!model.isBolus()) {
      return seedWashIn(t, y, c);
    }
    final double t0 = options.getOnsetHint() != null ? options.getOnsetHint() : t[0];
    final double[] above = new double[y.length];
    final double[] elapsed = new double[t.length];
    for (int i = 0; i < y.length; i++) {
      above[i] = Math.max(y[i] - c, 0);
      elapsed[i] = t[i] - t0;
    }
    final double auc = Math.max(MathUtils.trapz(t, above), 1e-9);
    final double median = MathUtils.median(elapsed);
    switch (model) {
      case LOGNORMAL:
        return new double[] {auc, Math.max(Math.log(Math.max(median, 1e-9)), 0), 0.5, t0, c};
      case GAMMA_VARIATE:
        return new double[] {auc, 2,
            Math.max(MathUtils.populationStandardDeviation(elapsed), 0.5), t0, c};
      default:
        return new double[] {auc, Math.max(median, 0.5), 2, t0, c};
    }
  }

  private static double[] seedWashIn(double[] t, double[] y, double c) {
    double a = 0;
    for (final double v : y) {
      a = Math.max(a, v - c);
    }
    a = Math.max(a, 1e-6);
    double b = Double.NaN;
    final double half = a / 2;
    for (int i = 0; i < y.length; i++) {
      if (y[i] - c >= half) {
        if (t[i] > 0) {
          b = LN2 / t[i];
        }
        break;
      }
    }
    if (!(b > 0)) {
      // Early slope: initial rate A*B
      final int k = Math.min(y.length - 1, 2);
      final double dt = t[k] - t[0];
      final double slope = dt > 0 ? (y[k] - y[0]) / dt : 0;
      b = slope / a;
    }
    if (!(b > 0) || Double.isInfinite(b)) {
      b = 1e-5;
    }
    return new double[] {a, Math.min(Math.max(b, 1e-5), 5)};
  }

  private static double[] clamp(double[] point, double[][] bounds) {
    for (int i = 0; i < point.length; i++) {
      point[i] = Math.min(Math.max(point[i], bounds[0][i]), bounds[1][i]);
    }
    return point;
  }
}
