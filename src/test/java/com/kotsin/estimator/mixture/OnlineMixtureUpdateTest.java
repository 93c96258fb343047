package com.kotsin.estimator.mixture;

import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.model.MixtureInput;
import com.kotsin.estimator.model.MixtureOutput;
import com.kotsin.estimator.model.MixtureState;
import com.kotsin.estimator.stats.BernoulliDistribution;
import com.kotsin.estimator.stats.MixtureModel;
import com.kotsin.estimator.stats.MultivariateGaussianDistribution;
import com.kotsin.estimator.stats.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OnlineMixtureUpdate")
class OnlineMixtureUpdateTest {

    private static <S> MixtureInput<S> batch(List<S> samples) {
        return MixtureInput.<S>builder().samples(samples).build();
    }

    private static long poissonSample(RandomGenerator rng, double rate) {
        double limit = Math.exp(-rate);
        double product = rng.nextDouble();
        long k = 0;
        while (product > limit) {
            product *= rng.nextDouble();
            k++;
        }
        return k;
    }

    // ========== CONVERGENCE ==========

    @Test
    @DisplayName("Recovers the rates and weights of a two component Poisson mixture")
    void testPoissonMixture() {
        RandomGenerator rng = new Well19937c(1L);
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(1.0), new PoissonDistribution(10.0))),
                StepSizePolicy.decaying(0.6));

        MixtureState<Long, PoissonDistribution> state = null;
        for (int step = 0; step < 2000; step++) {
            List<Long> samples = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                samples.add(poissonSample(rng, rng.nextDouble() < 0.3 ? 2.0 : 20.0));
            }
            state = em.update("counts", batch(samples), state);
        }

        MixtureModel<Long, PoissonDistribution> model = state.mixtureModel();
        assertEquals(2.0, model.distributions().get(0).rate(), 0.3);
        assertEquals(20.0, model.distributions().get(1).rate(), 1.0);
        assertEquals(0.3, model.weights()[0], 0.05);
        assertEquals(0.7, model.weights()[1], 0.05);
        assertEquals(2000L, state.stateIndex());
    }

    @Test
    @DisplayName("Recovers the means of two well separated gaussians")
    void testGaussianMixture() {
        RandomGenerator rng = new Well19937c(2L);
        double[][] identity = {{1, 0}, {0, 1}};
        OnlineMixtureUpdate<double[], MultivariateGaussianDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(
                        new MultivariateGaussianDistribution(new double[] {-1.0, 1.0}, identity),
                        new MultivariateGaussianDistribution(new double[] {6.0, 6.0}, identity))),
                StepSizePolicy.decaying(0.6));

        MixtureState<double[], MultivariateGaussianDistribution> state = null;
        for (int step = 0; step < 2000; step++) {
            List<double[]> samples = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                double offset = rng.nextDouble() < 0.5 ? 0.0 : 8.0;
                samples.add(new double[] {offset + rng.nextGaussian(), offset + rng.nextGaussian()});
            }
            state = em.update("points", batch(samples), state);
        }

        MixtureModel<double[], MultivariateGaussianDistribution> model = state.mixtureModel();
        assertArrayEquals(new double[] {0.0, 0.0}, model.distributions().get(0).mean(), 0.3);
        assertArrayEquals(new double[] {8.0, 8.0}, model.distributions().get(1).mean(), 0.3);
        assertEquals(0.5, model.weights()[0], 0.05);
        double variance = model.distributions().get(0).covariance()[0][0];
        assertTrue(variance > 0.6 && variance < 1.6, "variance was " + variance);
    }

    @Test
    @DisplayName("Bernoulli mixture keeps the overall success rate")
    void testBernoulliMixture() {
        RandomGenerator rng = new Well19937c(3L);
        OnlineMixtureUpdate<Boolean, BernoulliDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.of(new double[] {0.4, 0.6},
                        List.of(new BernoulliDistribution(0.2), new BernoulliDistribution(0.7))),
                StepSizePolicy.decaying(0.7));

        MixtureState<Boolean, BernoulliDistribution> state = null;
        for (int step = 0; step < 1000; step++) {
            List<Boolean> samples = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                samples.add(rng.nextDouble() < 0.3);
            }
            state = em.update("flips", batch(samples), state);
        }

        MixtureModel<Boolean, BernoulliDistribution> model = state.mixtureModel();
        double overall = model.weights()[0] * model.distributions().get(0).probability()
                + model.weights()[1] * model.distributions().get(1).probability();
        assertEquals(1.0, Arrays.stream(model.weights()).sum(), 1e-12);
        assertEquals(0.3, overall, 0.05);
    }

    // ========== WEIGHT NORMALIZATION ==========

    @Test
    @DisplayName("Poisson mixture weights sum to one after every step for step sizes in (0, 1]")
    void testPoissonWeightsSumToOne() {
        RandomGenerator rng = new Well19937c(11L);
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.of(new double[] {0.2, 0.3, 0.5}, List.of(
                        new PoissonDistribution(1.0), new PoissonDistribution(5.0), new PoissonDistribution(15.0))),
                StepSizePolicy.decaying(0.6));

        MixtureState<Long, PoissonDistribution> state = null;
        for (int step = 0; step < 500; step++) {
            List<Long> samples = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                samples.add(poissonSample(rng, rng.nextDouble() < 0.4 ? 3.0 : 12.0));
            }
            double stepSize = step % 50 == 0 ? 1.0 : 1.0 - rng.nextDouble();
            MixtureInput<Long> input = MixtureInput.<Long>builder().samples(samples).stepSize(stepSize).build();

            state = em.update("counts", input, state);

            double total = Arrays.stream(state.mixtureModel().weights()).sum();
            assertEquals(1.0, total, 1e-9, "weights drifted at step " + step + " with step size " + stepSize);
        }
    }

    @Test
    @DisplayName("Gaussian mixture weights sum to one after every step for varying step sizes")
    void testGaussianWeightsSumToOne() {
        RandomGenerator rng = new Well19937c(12L);
        double[][] identity = {{1, 0}, {0, 1}};
        OnlineMixtureUpdate<double[], MultivariateGaussianDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(
                        new MultivariateGaussianDistribution(new double[] {0.0, 0.0}, identity),
                        new MultivariateGaussianDistribution(new double[] {3.0, 3.0}, identity))),
                StepSizePolicy.decaying(0.6));

        MixtureState<double[], MultivariateGaussianDistribution> state = null;
        for (int step = 0; step < 500; step++) {
            List<double[]> samples = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                double offset = rng.nextDouble() < 0.5 ? 0.0 : 3.0;
                samples.add(new double[] {offset + rng.nextGaussian(), offset + rng.nextGaussian()});
            }
            // strictly below one so the blended covariance keeps the prior's positive definite part
            double stepSize = 0.99 * (1.0 - rng.nextDouble());
            MixtureInput<double[]> input = MixtureInput.<double[]>builder().samples(samples).stepSize(stepSize).build();

            state = em.update("points", input, state);

            double total = Arrays.stream(state.mixtureModel().weights()).sum();
            assertEquals(1.0, total, 1e-9, "weights drifted at step " + step + " with step size " + stepSize);
        }
    }

    // ========== SINGLE STEPS ==========

    @Test
    @DisplayName("Step size one replaces the summary with the batch statistics")
    void testFullStep() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(3.0))), StepSizePolicy.constant(1.0));

        MixtureState<Long, PoissonDistribution> state = em.update("k", batch(List.of(7L)), null);

        assertEquals(7.0, state.mixtureModel().distributions().get(0).rate(), 1e-12);
        assertEquals(1.0, state.mixtureModel().weights()[0], 1e-12);
    }

    @Test
    @DisplayName("Input step size overrides the policy")
    void testStepSizeOverride() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(3.0))), StepSizePolicy.constant(1.0));
        MixtureInput<Long> input = MixtureInput.<Long>builder().samples(List.of(7L)).stepSize(0.5).build();

        MixtureState<Long, PoissonDistribution> state = em.update("k", input, null);

        assertEquals(5.0, state.mixtureModel().distributions().get(0).rate(), 1e-12);
    }

    @Test
    @DisplayName("Input step size outside (0, 1] fails the step")
    void testInvalidStepSizeOverride() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(3.0))), StepSizePolicy.constant(0.5));
        MixtureInput<Long> input = MixtureInput.<Long>builder().samples(List.of(7L)).stepSize(1.5).build();

        assertThrows(EstimationException.class, () -> em.update("k", input, null));
    }

    @Test
    @DisplayName("Input without samples advances the index and keeps the model")
    void testNoSamples() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(1.0), new PoissonDistribution(5.0))),
                StepSizePolicy.constant(0.5));
        MixtureState<Long, PoissonDistribution> first = em.update("k", batch(List.of(3L, 4L)), null);

        MixtureState<Long, PoissonDistribution> second = em.update("k", batch(List.of()), first);
        MixtureOutput output = em.output("k", batch(List.of()), second);

        assertEquals(2L, second.stateIndex());
        assertEquals(first.mixtureModel(), second.mixtureModel());
        assertEquals(first.summaryModel(), second.summaryModel());
        assertNull(output.getLoglikelihood());
        assertEquals(2L, output.getStateIndex());
    }

    @Test
    @DisplayName("Initial summary holds each distribution scaled by its weight")
    void testInitialSummary() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.of(new double[] {0.25, 0.75}, List.of(new PoissonDistribution(4.0), new PoissonDistribution(8.0))),
                StepSizePolicy.constant(0.5));

        MixtureState<Long, PoissonDistribution> initial = em.initialState();

        assertEquals(0L, initial.stateIndex());
        assertEquals(1.0, initial.summaryModel().distributions().get(0).rate(), 1e-12);
        assertEquals(6.0, initial.summaryModel().distributions().get(1).rate(), 1e-12);
        assertEquals(em.getInitialModel(), initial.mixtureModel());
    }

    @Test
    @DisplayName("Output scores the batch under the updated model")
    void testOutputLoglikelihood() {
        OnlineMixtureUpdate<Long, PoissonDistribution> em = new OnlineMixtureUpdate<>(
                MixtureModel.uniform(List.of(new PoissonDistribution(3.0))), StepSizePolicy.constant(1.0));
        MixtureInput<Long> input = batch(List.of(2L, 4L));

        MixtureState<Long, PoissonDistribution> state = em.update("k", input, null);
        MixtureOutput output = em.output("k", input, state);

        double expected = (new PoissonDistribution(3.0).loglikelihood(2L) + new PoissonDistribution(3.0).loglikelihood(4L)) / 2;
        assertEquals(expected, output.getLoglikelihood(), 1e-12);
        assertSame(state.mixtureModel(), output.getMixtureModel());
    }

    // ========== BATCH TRAINING ==========

    @Test
    @DisplayName("Batch training with step size one never lowers the batch likelihood")
    void testBatchTraining() {
        MixtureModel<Long, PoissonDistribution> initial = MixtureModel.uniform(
                List.of(new PoissonDistribution(4.0), new PoissonDistribution(6.0)));
        List<Long> samples = List.of(0L, 1L, 2L, 1L, 3L, 15L, 18L, 22L, 19L, 17L);

        OnlineMixtureUpdate<Long, PoissonDistribution> once = new OnlineMixtureUpdate<>(
                initial, StepSizePolicy.constant(1.0), 1, 0.0);
        OnlineMixtureUpdate<Long, PoissonDistribution> trained = new OnlineMixtureUpdate<>(
                initial, StepSizePolicy.constant(1.0), 50, 1e-9);

        MixtureModel<Long, PoissonDistribution> a = once.update("k", batch(samples), null).mixtureModel();
        MixtureModel<Long, PoissonDistribution> b = trained.update("k", batch(samples), null).mixtureModel();

        double before = OnlineMixtureUpdate.meanLoglikelihood(initial, samples);
        double afterOne = OnlineMixtureUpdate.meanLoglikelihood(a, samples);
        double afterMany = OnlineMixtureUpdate.meanLoglikelihood(b, samples);
        assertTrue(afterOne >= before);
        assertTrue(afterMany >= afterOne - 1e-12);
        assertEquals(1.4, Math.min(b.distributions().get(0).rate(), b.distributions().get(1).rate()), 0.1);
    }

    // ========== VALIDATION ==========

    @Test
    @DisplayName("Invalid initial models and batch settings are configuration errors")
    void testValidation() {
        MixtureModel<Long, PoissonDistribution> unnormalized = new MixtureModel<>(
                new double[] {0.5, 0.6}, List.of(new PoissonDistribution(1.0), new PoissonDistribution(2.0)));
        MixtureModel<Long, PoissonDistribution> valid = MixtureModel.uniform(List.of(new PoissonDistribution(1.0)));

        assertThrows(EstimatorConfigurationException.class,
                () -> new OnlineMixtureUpdate<>(unnormalized, StepSizePolicy.constant(0.5)));
        assertThrows(EstimatorConfigurationException.class,
                () -> new OnlineMixtureUpdate<>(valid, StepSizePolicy.constant(0.5), 0, 0.0));
        assertThrows(EstimatorConfigurationException.class,
                () -> new OnlineMixtureUpdate<>(valid, StepSizePolicy.constant(0.5), 5, -1.0));
    }
}
