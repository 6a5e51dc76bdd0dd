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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.ceus.InputShapeException;
import uk.ac.sussex.gdsc.ceus.data.TimeIntensityCurve;

@SuppressWarnings({"javadoc"})
class ModelFitterTest {
  private static double[] createTime(int size, double step) {
    final double[] t = new double[size];
    for (int i = 0; i < size; i++) {
      t[i] = i * step;
    }
    return t;
  }

  private static FitOptions createOptions(int restarts) {
    final FitOptions options = new FitOptions();
    options.setRestarts(restarts);
    options.setSeed(12345L);
    options.setThreads(2);
    return options;
  }

  @Test
  void testFitWashIn() {
    final double[] t = createTime(101, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = 50 * (1 - Math.exp(-0.3 * t[i]));
    }
    final ModelFitResults results = new ModelFitter(createOptions(25)).fit(t, y,
        Collections.singleton(KineticModel.WASH_IN));
    final FitResult result = results.get(KineticModel.WASH_IN).get();
    Assertions.assertEquals(50, result.getParameter("A"), 50 * 0.05);
    Assertions.assertEquals(0.3, result.getParameter("B"), 0.3 * 0.05);
    final double ab = result.getDerivedParameters().get("A*B");
    Assertions.assertEquals(15, ab, 15 * 0.05);
    Assertions.assertTrue(result.getRSquared() > 0.999);
    // Only the points up to the maximum wash-in time are used
    Assertions.assertEquals(51, result.getTime().length);
    Assertions.assertEquals(5, result.getTime()[50], 1e-10);
    Assertions.assertFalse(results.getBestBolus().isPresent());
  }

  @Test
  void testFitLognormal() {
    final double[] t = createTime(121, 0.25);
    final double[] expected = {100, Math.log(4), 0.4, 2, 5};
    final double[] y = KineticModel.LOGNORMAL.createFunction(t).values(expected);
    final FitOptions options = createOptions(20);
    options.setOnsetHint(1.5);
    final ModelFitResults results =
        new ModelFitter(options).fit(t, y, Collections.singleton(KineticModel.LOGNORMAL));
    final FitResult result = results.get(KineticModel.LOGNORMAL).get();
    final double[] p = result.getParameters();
    for (int i = 0; i < expected.length; i++) {
      Assertions.assertEquals(expected[i], p[i], Math.abs(expected[i]) * 0.05);
    }
    Assertions.assertTrue(result.getRSquared() > 0.999);
    Assertions.assertSame(result, results.getBestBolus().get());
    final double mtt = result.getDerivedParameters().get("MTT");
    Assertions.assertEquals(Math.exp(Math.log(4) + 0.08), mtt, mtt * 0.05);
  }

  @Test
  void testFitAllModelsToBolus() {
    final double[] t = createTime(121, 0.25);
    final double[] y =
        KineticModel.GAMMA_VARIATE.createFunction(t).values(new double[] {80, 3, 1.5, 3, 2});
    final ModelFitResults results =
        new ModelFitter(createOptions(10)).fit(t, y, EnumSet.allOf(KineticModel.class));
    for (final KineticModel model : KineticModel.values()) {
      Assertions.assertTrue(
          results.get(model).isPresent() || results.getFailures().containsKey(model),
          model::toString);
    }
    final FitResult best = results.getBestBolus().get();
    Assertions.assertTrue(best.getModel().isBolus());
    Assertions.assertTrue(best.getRSquared() > 0.99);
    for (final FitResult r : results.getResults().values()) {
      if (r.getModel().isBolus()) {
        Assertions.assertTrue(best.getResidualSumOfSquares() <= r.getResidualSumOfSquares());
      }
    }
  }

  @Test
  void testInsufficientDataIsRecorded() {
    final double[] t = {0, 6, 7, 8};
    final double[] y = {0, 1, 2, 3};
    final ModelFitResults results = new ModelFitter(createOptions(5)).fit(t, y,
        Arrays.asList(KineticModel.WASH_IN, KineticModel.LOGNORMAL));
    Assertions.assertTrue(results.getFailures().containsKey(KineticModel.WASH_IN));
    Assertions.assertTrue(results.getFailures().containsKey(KineticModel.LOGNORMAL));
    Assertions.assertTrue(results.getResults().isEmpty());
  }

  @Test
  void testFitCurveUsesIncludedPoints() {
    final double[] raw = new double[60];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = 10 + 40 * (1 - Math.exp(-0.5 * i / 10.0));
    }
    // An outlier that is excluded
    raw[20] = 1000;
    final TimeIntensityCurve curve = TimeIntensityCurve.fromFrames("a", raw, 10);
    curve.setIncluded(20, false);
    final FitResult result = new ModelFitter(createOptions(25))
        .fit(curve, Collections.singleton(KineticModel.WASH_IN)).get(KineticModel.WASH_IN)
        .get();
    Assertions.assertEquals(40, result.getParameter("A"), 2);
    Assertions.assertEquals(0.5, result.getParameter("B"), 0.025);
    Assertions.assertEquals(50, result.getTime().length);
  }

  @Test
  void testMismatchedLengths() {
    final ModelFitter fitter = new ModelFitter(createOptions(1));
    Assertions.assertThrows(InputShapeException.class, () -> fitter.fit(new double[3],
        new double[4], Collections.singleton(KineticModel.WASH_IN)));
  }

  @Test
  void testCreateStartsIsReproducible() {
    final double[] seed = {10, 2, 0.5};
    final double[][] bounds = {{0, 0, 0}, {12, 100, 100}};
    final UniformRandomProvider rng1 = RandomSource.XO_RO_SHI_RO_128_PP.create(99L);
    final UniformRandomProvider rng2 = RandomSource.XO_RO_SHI_RO_128_PP.create(99L);
    final List<double[]> s1 = ModelFitter.createStarts(seed, bounds, 30, rng1);
    final List<double[]> s2 = ModelFitter.createStarts(seed, bounds, 30, rng2);
    Assertions.assertEquals(30, s1.size());
    Assertions.assertArrayEquals(seed, s1.get(0));
    for (int i = 0; i < s1.size(); i++) {
      Assertions.assertArrayEquals(s1.get(i), s2.get(i));
      final double[] start = s1.get(i);
      for (int j = 0; j < start.length; j++) {
        Assertions.assertTrue(start[j] >= bounds[0][j] && start[j] <= bounds[1][j]);
        Assertions.assertTrue(start[j] >= seed[j] * 0.5 && start[j] <= seed[j] * 1.5);
      }
    }
  }

  @Test
  void testSeededFitsAreReproducible() {
    final double[] t = createTime(51, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = 20 * (1 - Math.exp(-0.8 * t[i])) + ((i & 1) == 0 ? 0.5 : -0.5);
    }
    final FitResult r1 = new ModelFitter(createOptions(10))
        .fit(t, y, Collections.singleton(KineticModel.WASH_IN)).get(KineticModel.WASH_IN).get();
    final FitResult r2 = new ModelFitter(createOptions(10))
        .fit(t, y, Collections.singleton(KineticModel.WASH_IN)).get(KineticModel.WASH_IN).get();
    Assertions.assertArrayEquals(r1.getParameters(), r2.getParameters());
    Assertions.assertEquals(r1.getStartIndex(), r2.getStartIndex());
  }

  @Test
  void testUserBounds() {
    final double[] t = createTime(51, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = 50 * (1 - Math.exp(-0.3 * t[i]));
    }
    final FitOptions options = createOptions(5);
    options.setBounds(KineticModel.WASH_IN, new double[] {0, 0.5}, new double[] {100, 5});
    final FitResult result = new ModelFitter(options)
        .fit(t, y, Collections.singleton(KineticModel.WASH_IN)).get(KineticModel.WASH_IN).get();
    Assertions.assertTrue(result.getParameter("B") >= 0.5);
  }

  @Test
  void testPredictIsAnchored() {
    final double[] t = createTime(51, 0.1);
    final double[] y = new double[t.length];
    for (int i = 0; i < t.length; i++) {
      y[i] = 30 * (1 - Math.exp(-0.6 * t[i]));
    }
    final FitResult result = new ModelFitter(createOptions(10))
        .fit(t, y, Collections.singleton(KineticModel.WASH_IN)).get(KineticModel.WASH_IN).get();
    final double[] curve = result.getCurve();
    Assertions.assertEquals(0, curve[0], 1e-6);
    final double[] predicted = result.predict(new double[] {0, 1, 8});
    Assertions.assertEquals(0, predicted[0], 1e-6);
    Assertions.assertEquals(30 * (1 - Math.exp(-0.6)), predicted[1], 0.5);
    Assertions.assertEquals(30 * (1 - Math.exp(-4.8)), predicted[2], 1);
  }
}
