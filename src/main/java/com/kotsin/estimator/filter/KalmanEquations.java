package com.kotsin.estimator.filter;

import com.kotsin.estimator.exception.EstimatorConfigurationException;
import com.kotsin.estimator.exception.ShapeMismatchException;
import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.model.KalmanState;
import com.kotsin.estimator.stats.MultivariateGaussian;
import com.kotsin.estimator.util.ValidationUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Equations shared by the linear and extended filters once the model has been linearized.
 */
final class KalmanEquations {

    private KalmanEquations() {}

    static double checkFadingFactor(double fadingFactor) {
        if (!(fadingFactor >= 1.0) || Double.isInfinite(fadingFactor)) {
            throw new EstimatorConfigurationException("Fading factor must be finite and >= 1, got " + fadingFactor);
        }
        return fadingFactor;
    }

    /**
     * {@code λ·J·P·Jᵗ + Q}
     */
    static RealMatrix propagateCovariance(RealMatrix jacobian, RealMatrix covariance, RealMatrix noise,
                                          double fadingFactor) {
        RealMatrix propagated = jacobian.multiply(covariance).multiply(jacobian.transpose());
        if (fadingFactor != 1.0) {
            propagated = propagated.scalarMultiply(fadingFactor);
        }
        return propagated.add(noise);
    }

    /**
     * {@code G·Q·Gᵗ}, or {@code Q} when the noise enters additively.
     */
    static RealMatrix effectiveNoise(RealMatrix noiseJacobian, RealMatrix noise) {
        if (noiseJacobian == null) {
            return noise;
        }
        if (noiseJacobian.getColumnDimension() != noise.getRowDimension()) {
            throw new ShapeMismatchException(String.format(
                    "Noise Jacobian is %dx%d but noise covariance is %dx%d",
                    noiseJacobian.getRowDimension(), noiseJacobian.getColumnDimension(),
                    noise.getRowDimension(), noise.getColumnDimension()));
        }
        return noiseJacobian.multiply(noise).multiply(noiseJacobian.transpose());
    }

    static RealVector controlled(RealVector predictedMean, KalmanSystem system) {
        if (!system.hasControl()) {
            return predictedMean;
        }
        RealMatrix b = ValidationUtils.requireShape(system.controlFunction(),
                predictedMean.getDimension(), system.control().getDimension(), "controlFunction");
        return predictedMean.add(b.operate(system.control()));
    }

    static KalmanState predicted(KalmanState state, RealVector mean, RealMatrix covariance) {
        int n = state.state().length;
        ValidationUtils.requireSize(mean, n, "predicted state");
        ValidationUtils.requireShape(covariance, n, n, "predicted covariance");
        return new KalmanState(state.stateIndex() + 1, mean.toArray(), covariance.getData(),
                null, null, state.slidingLoglikelihood());
    }

    /**
     * Measurement update given the residual and the linearized measurement model.
     *
     * <pre>
     * S = H·P'·Hᵗ + R
     * K = P'·Hᵗ·S⁻¹      (Cholesky solve of S·Kᵗ = H·P')
     * x = x' + K·r
     * P = (I − K·H)·P'
     * </pre>
     */
    static KalmanState update(KalmanState predicted, RealVector residual, RealMatrix measurementJacobian,
                              RealMatrix measurementNoise, boolean storeResidual, int likelihoodWindow) {
        RealVector x = LinalgUtils.toVector(predicted.state());
        RealMatrix p = LinalgUtils.toMatrix(predicted.stateCovariance());
        int n = x.getDimension();
        int m = residual.getDimension();
        ValidationUtils.requireShape(measurementJacobian, m, n, "measurement Jacobian");
        ValidationUtils.requireShape(measurementNoise, m, m, "measurement noise");

        RealMatrix hp = measurementJacobian.multiply(p);
        RealMatrix s = LinalgUtils.symmetrize(hp.multiply(measurementJacobian.transpose()).add(measurementNoise));
        RealMatrix gain = LinalgUtils.solveSymmetric(s, hp).transpose();

        RealVector mean = x.add(gain.operate(residual));
        RealMatrix covariance = LinalgUtils.identity(n).subtract(gain.multiply(measurementJacobian)).multiply(p);

        List<Double> window = predicted.slidingLoglikelihood();
        if (likelihoodWindow > 0) {
            window = SlidingLikelihood.push(window, MultivariateGaussian.residualLogpdf(residual, s), likelihoodWindow);
        }
        return new KalmanState(predicted.stateIndex(), mean.toArray(), covariance.getData(),
                storeResidual ? residual.toArray() : null,
                storeResidual ? s.getData() : null,
                window);
    }
}
