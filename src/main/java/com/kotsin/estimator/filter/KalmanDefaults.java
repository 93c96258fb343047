package com.kotsin.estimator.filter;

import com.kotsin.estimator.linalg.LinalgUtils;
import com.kotsin.estimator.util.ValidationUtils;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Configured dimensions and default system matrices of a Kalman estimator. Inputs may override
 * any matrix for a single step.
 */
@Value
@Builder(toBuilder = true)
public class KalmanDefaults {

    int stateSize;
    int measurementSize;
    RealVector initialState;
    RealMatrix initialCovariance;
    RealMatrix processModel;
    RealMatrix processNoise;
    RealMatrix measurementModel;
    RealMatrix measurementNoise;

    /**
     * Optional; a step applies {@code B·u} only when its input carries a control vector.
     */
    RealMatrix controlFunction;

    /**
     * Zero initial state, identity covariances and process model, and a measurement model
     * reading the leading {@code measurementSize} state entries.
     */
    public static KalmanDefaults standard(int stateSize, int measurementSize) {
        ValidationUtils.checkPositive(stateSize, "stateSize");
        ValidationUtils.checkPositive(measurementSize, "measurementSize");
        return KalmanDefaults.builder()
                .stateSize(stateSize)
                .measurementSize(measurementSize)
                .initialState(LinalgUtils.zeros(stateSize))
                .initialCovariance(LinalgUtils.identity(stateSize))
                .processModel(LinalgUtils.identity(stateSize))
                .processNoise(LinalgUtils.identity(stateSize))
                .measurementModel(LinalgUtils.eye(measurementSize, stateSize))
                .measurementNoise(LinalgUtils.identity(measurementSize))
                .build();
    }

    /**
     * Checks shared by all Kalman estimators: sizes, initial belief and square noise matrices.
     */
    public KalmanDefaults validate() {
        ValidationUtils.checkPositive(stateSize, "stateSize");
        ValidationUtils.checkPositive(measurementSize, "measurementSize");
        ValidationUtils.checkSize(initialState, stateSize, "initialState");
        ValidationUtils.checkShape(initialCovariance, stateSize, stateSize, "initialCovariance");
        ValidationUtils.checkNotNull(processModel, "processModel");
        ValidationUtils.checkNotNull(measurementModel, "measurementModel");
        ValidationUtils.checkArgument(ValidationUtils.checkNotNull(processNoise, "processNoise").isSquare(),
                "processNoise must be square");
        ValidationUtils.checkArgument(ValidationUtils.checkNotNull(measurementNoise, "measurementNoise").isSquare(),
                "measurementNoise must be square");
        if (controlFunction != null) {
            ValidationUtils.checkArgument(controlFunction.getRowDimension() == stateSize,
                    "controlFunction must have " + stateSize + " rows");
        }
        return this;
    }

    /**
     * Additional checks when the matrices are used directly as {@code F}, {@code Q}, {@code H}, {@code R}.
     */
    public KalmanDefaults validateLinear() {
        validate();
        ValidationUtils.checkShape(processModel, stateSize, stateSize, "processModel");
        ValidationUtils.checkShape(processNoise, stateSize, stateSize, "processNoise");
        ValidationUtils.checkShape(measurementModel, measurementSize, stateSize, "measurementModel");
        ValidationUtils.checkShape(measurementNoise, measurementSize, measurementSize, "measurementNoise");
        return this;
    }
}
