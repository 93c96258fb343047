package com.kotsin.estimator.filter;

import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.model.KalmanOutput;
import com.kotsin.estimator.model.MultipleModelEstimate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MultipleModelAggregator")
class MultipleModelAggregatorTest {

    private static KalmanOutput output(String key, String group, long index, double x, double p, Double loglikelihood,
                                       Long eventTime) {
        return KalmanOutput.builder()
                .stateKey(key)
                .modelGroup(group)
                .stateIndex(index)
                .state(new double[] {x})
                .stateCovariance(new double[][] {{p}})
                .slidingLoglikelihood(loglikelihood)
                .eventTime(eventTime)
                .build();
    }

    // ========== WEIGHTS ==========

    @Test
    @DisplayName("Equal likelihoods give equal weights")
    void testEqualWeights() {
        assertArrayEquals(new double[] {0.5, 0.5}, MultipleModelAggregator.modelWeights(new double[] {-3.0, -3.0}), 1e-12);
    }

    @Test
    @DisplayName("Weights survive likelihoods that underflow exp")
    void testUnderflowingLikelihoods() {
        double[] weights = MultipleModelAggregator.modelWeights(new double[] {-2000.0, -2000.0 + Math.log(3.0)});

        assertArrayEquals(new double[] {0.25, 0.75}, weights, 1e-12);
    }

    // ========== AGGREGATE ==========

    @Test
    @DisplayName("State and covariance are the weighted averages")
    void testAggregate() {
        Map<String, KalmanOutput> outputs = new LinkedHashMap<>();
        outputs.put("a", output("a", "g", 4L, 0.0, 1.0, 0.0, null));
        outputs.put("b", output("b", "g", 4L, 4.0, 3.0, Math.log(3.0), null));

        MultipleModelEstimate estimate = MultipleModelAggregator.aggregate("g", 4L, outputs);

        assertEquals("g", estimate.getModelGroup());
        assertEquals(4L, estimate.getStateIndex());
        assertEquals(2, estimate.getModelCount());
        assertEquals(3.0, estimate.getState()[0], 1e-12);
        assertEquals(2.5, estimate.getStateCovariance()[0][0], 1e-12);
        assertEquals(0.25, estimate.getModelWeights().get("a"), 1e-12);
        assertEquals(0.75, estimate.getModelWeights().get("b"), 1e-12);
    }

    @Test
    @DisplayName("Outputs without a sliding likelihood cannot be aggregated")
    void testAggregate_MissingLikelihood() {
        Map<String, KalmanOutput> outputs = Map.of("a", output("a", "g", 1L, 0.0, 1.0, null, null));

        assertThrows(EstimationException.class, () -> MultipleModelAggregator.aggregate("g", 1L, outputs));
        assertThrows(EstimationException.class, () -> MultipleModelAggregator.aggregate("g", 1L, Map.of()));
    }
}
