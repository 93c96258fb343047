package com.kotsin.estimator.filter;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanInput;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.model.RegressionInput;
import com.kotsin.estimator.model.RegressionOutput;
import com.kotsin.estimator.model.RlsState;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecursiveLeastSquaresUpdate")
class RecursiveLeastSquaresUpdateTest {

    private static RegressionInput labelled(double[] features, double label) {
        return RegressionInput.builder().features(features).label(label).build();
    }

    // ========== EQUIVALENCE ==========

    @Test
    @DisplayName("Without forgetting, RLS equals a Kalman filter with static state and unit noise")
    void testMatchesKalmanFilter() {
        RandomGenerator rng = new Well19937c(3L);
        RecursiveLeastSquaresUpdate rls = new RecursiveLeastSquaresUpdate(3, 1.0,
                LinalgUtils.zeros(3), LinalgUtils.diagonal(3, 100.0));
        KalmanStateUpdate kalman = new KalmanStateUpdate(
                KalmanDefaults.standard(3, 1).toBuilder()
                        .initialCovariance(LinalgUtils.diagonal(3, 100.0))
                        .processNoise(LinalgUtils.zeros(3, 3))
                        .build(),
                new LinearKalmanStateCompute(), KalmanOutputOptions.defaults());

        RlsState rlsState = null;
        KalmanState kalmanState = null;
        for (int i = 0; i < 100; i++) {
            double[] x = {1.0, rng.nextGaussian(), rng.nextGaussian()};
            double y = 1.0 + 2.0 * x[1] - 3.0 * x[2] + rng.nextGaussian();
            rlsState = rls.update("k", labelled(x, y), rlsState);
            kalmanState = kalman.update("k", KalmanInput.builder()
                    .measurement(new double[] {y})
                    .measurementModel(new double[][] {x})
                    .build(), kalmanState);
        }

        assertArrayEquals(kalmanState.state(), rlsState.state(), 1e-8);
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(kalmanState.stateCovariance()[i], rlsState.covariance()[i], 1e-8);
        }
    }

    // ========== CONVERGENCE ==========

    @Test
    @DisplayName("Recovers a noiseless linear target from the default prior")
    void testNoiselessConvergence() {
        RandomGenerator rng = new Well19937c(5L);
        RecursiveLeastSquaresUpdate rls = new RecursiveLeastSquaresUpdate(2, 1.0);

        RlsState state = null;
        for (int i = 0; i < 50; i++) {
            double[] x = {rng.nextGaussian(), rng.nextGaussian()};
            state = rls.update("k", labelled(x, 4.0 * x[0] - x[1]), state);
        }

        assertArrayEquals(new double[] {4.0, -1.0}, state.state(), 1e-4);
    }

    @Test
    @DisplayName("Forgetting factor tracks a drifting coefficient")
    void testForgettingTracksDrift() {
        RandomGenerator rng = new Well19937c(9L);
        RecursiveLeastSquaresUpdate forgetting = new RecursiveLeastSquaresUpdate(1, 0.9);
        RecursiveLeastSquaresUpdate remembering = new RecursiveLeastSquaresUpdate(1, 1.0);

        RlsState a = null;
        RlsState b = null;
        for (int i = 0; i < 400; i++) {
            double coefficient = i < 200 ? 1.0 : 3.0;
            double[] x = {rng.nextGaussian()};
            RegressionInput input = labelled(x, coefficient * x[0] + 0.1 * rng.nextGaussian());
            a = forgetting.update("k", input, a);
            b = remembering.update("k", input, b);
        }

        assertEquals(3.0, a.state()[0], 0.1);
        assertTrue(Math.abs(b.state()[0] - 3.0) > 0.5, "unweighted estimate was " + b.state()[0]);
    }

    // ========== STEP SELECTION ==========

    @Test
    @DisplayName("Input without label advances the index and keeps the estimate")
    void testNoLabel() {
        RecursiveLeastSquaresUpdate rls = new RecursiveLeastSquaresUpdate(2, 1.0);
        RlsState first = rls.update("k", labelled(new double[] {1.0, 2.0}, 3.0), null);

        RlsState second = rls.update("k", RegressionInput.builder().features(new double[] {5.0, 5.0}).build(), first);

        assertEquals(2L, second.stateIndex());
        assertArrayEquals(first.state(), second.state(), 0.0);
        assertArrayEquals(first.covariance()[0], second.covariance()[0], 0.0);
    }

    @Test
    @DisplayName("Output reports the a posteriori residual")
    void testOutput() {
        RecursiveLeastSquaresUpdate rls = new RecursiveLeastSquaresUpdate(1, 1.0);
        RegressionInput input = labelled(new double[] {2.0}, 4.0);
        input.setEventTime(77L);

        RlsState state = rls.update("k", input, null);
        RegressionOutput output = rls.output("k", input, state);

        assertEquals(1L, output.getStateIndex());
        assertEquals(77L, output.getEventTime());
        assertEquals(4.0 - 2.0 * state.state()[0], output.getResidual(), 1e-12);
        assertNotNull(output.getCovariance());
    }

    // ========== VALIDATION ==========

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.5, 1.01, Double.NaN})
    @DisplayName("Forgetting factor outside (0, 1] is a configuration error")
    void testForgettingFactorValidation(double forgettingFactor) {
        assertThrows(EstimatorConfigurationException.class, () -> new RecursiveLeastSquaresUpdate(2, forgettingFactor));
    }

    @Test
    @DisplayName("Features of the wrong size are a shape mismatch")
    void testFeatureSizeMismatch() {
        RecursiveLeastSquaresUpdate rls = new RecursiveLeastSquaresUpdate(2, 1.0);

        assertThrows(ShapeMismatchException.class, () -> rls.update("k", labelled(new double[] {1.0}, 1.0), null));
        assertThrows(ShapeMismatchException.class,
                () -> rls.update("k", RegressionInput.builder().label(1.0).build(), null));
    }

    @Test
    @DisplayName("Default inverse covariance is a large multiple of the identity")
    void testDefaultCovariance() {
        RlsState state = new RecursiveLeastSquaresUpdate(2, 1.0)
                .update("k", RegressionInput.builder().build(), null);

        assertEquals(1e6, state.covariance()[0][0], 1e-6);
        assertEquals(0.0, state.covariance()[0][1], 0.0);
    }
}
