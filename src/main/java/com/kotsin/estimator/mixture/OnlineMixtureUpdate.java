package com.kotsin.estimator.mixture;

import com.kotsin.estimator.exception.EstimationException;
import com.kotsin.estimator.filter.StateTransition;
import com.kotsin.estimator.model.MixtureInput;
import com.kotsin.estimator.model.MixtureOutput;
import com.kotsin.estimator.model.MixtureState;
import com.kotsin.estimator.stats.Distribution;
import com.kotsin.estimator.stats.MixtureModel;
import com.kotsin.estimator.util.MathUtils;
import com.kotsin.estimator.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Online expectation maximization for a finite mixture (Cappé and Moulines).
 *
 * <p>The state carries a summary: a mixture of unnormalized weights and distributions holding
 * exponentially averaged sufficient statistics. Each input is one step:</p>
 * <pre>
 * E: r_ik = w_k·f_k(s_i) / Σ_j w_j·f_j(s_i)
 *    stats = (Σ_i r_ik / N, f_k.summarize(r_·k, samples))
 *    summary' = (1 − γ)·summary + γ·stats
 * M: w_k = summary'.w_k,  f_k = summary'.f_k / summary'.w_k
 * </pre>
 *
 * <p>With batch training enabled the E and M steps are repeated on the same batch, always from
 * the prior summary, until the mean log-likelihood changes by less than the tolerance.</p>
 */
@Slf4j
public class OnlineMixtureUpdate<S, D extends Distribution<S, D>>
        implements StateTransition<MixtureInput<S>, MixtureState<S, D>, MixtureOutput> {

    private final MixtureModel<S, D> initialModel;
    private final StepSizePolicy stepSizePolicy;
    private final int batchTrainMaxIter;
    private final double batchTrainTol;

    public OnlineMixtureUpdate(MixtureModel<S, D> initialModel, StepSizePolicy stepSizePolicy,
                               int batchTrainMaxIter, double batchTrainTol) {
        this.initialModel = MixtureModel.of(
                ValidationUtils.checkNotNull(initialModel, "initialModel").weights(), initialModel.distributions());
        this.stepSizePolicy = ValidationUtils.checkNotNull(stepSizePolicy, "stepSizePolicy");
        ValidationUtils.checkPositive(batchTrainMaxIter, "batchTrainMaxIter");
        ValidationUtils.checkArgument(batchTrainTol >= 0.0, "batchTrainTol must not be negative, got " + batchTrainTol);
        this.batchTrainMaxIter = batchTrainMaxIter;
        this.batchTrainTol = batchTrainTol;
    }

    public OnlineMixtureUpdate(MixtureModel<S, D> initialModel, StepSizePolicy stepSizePolicy) {
        this(initialModel, stepSizePolicy, 1, 0.0);
    }

    public MixtureModel<S, D> getInitialModel() {
        return initialModel;
    }

    @Override
    public MixtureState<S, D> update(String key, MixtureInput<S> input, MixtureState<S, D> priorState) {
        MixtureState<S, D> current = priorState == null ? initialState() : priorState;
        List<S> samples = input.getSamples();
        if (samples == null || samples.isEmpty()) {
            return new MixtureState<>(current.stateIndex() + 1, current.summaryModel(), current.mixtureModel());
        }

        double stepSize = stepSize(input, current.stateIndex());
        MixtureModel<S, D> model = current.mixtureModel();
        MixtureModel<S, D> summary = current.summaryModel();
        double loglikelihood = meanLoglikelihood(model, samples);

        for (int iter = 1; iter <= batchTrainMaxIter; iter++) {
            summary = current.summaryModel().scale(1.0 - stepSize).combine(stepSize, statistics(model, samples));
            model = maximize(summary, model);
            if (iter == batchTrainMaxIter) {
                break;
            }
            double next = meanLoglikelihood(model, samples);
            if (Math.abs(next - loglikelihood) < batchTrainTol) {
                log.debug("Batch EM for key {} converged after {} iterations", key, iter);
                break;
            }
            loglikelihood = next;
        }
        return new MixtureState<>(current.stateIndex() + 1, summary, model);
    }

    @Override
    public MixtureOutput output(String key, MixtureInput<S> input, MixtureState<S, D> state) {
        MixtureOutput.MixtureOutputBuilder builder = MixtureOutput.builder()
                .stateKey(key)
                .stateIndex(state.stateIndex())
                .mixtureModel(state.mixtureModel())
                .eventTime(input.getEventTime());
        if (input.getSamples() != null && !input.getSamples().isEmpty()) {
            builder.loglikelihood(meanLoglikelihood(state.mixtureModel(), input.getSamples()));
        }
        return builder.build();
    }

    MixtureState<S, D> initialState() {
        List<D> scaled = new ArrayList<>(initialModel.size());
        for (int k = 0; k < initialModel.size(); k++) {
            scaled.add(initialModel.distributions().get(k).scale(initialModel.weights()[k]));
        }
        return new MixtureState<>(0L, new MixtureModel<>(initialModel.weights(), scaled), initialModel);
    }

    private double stepSize(MixtureInput<S> input, long stateIndex) {
        if (input.getStepSize() == null) {
            return stepSizePolicy.stepSize(stateIndex);
        }
        double stepSize = input.getStepSize();
        if (!(stepSize > 0.0 && stepSize <= 1.0)) {
            throw new EstimationException("Input step size must be in (0, 1], got " + stepSize);
        }
        return stepSize;
    }

    /**
     * Responsibility-weighted sufficient statistics of a batch, shaped like the summary.
     */
    static <S, D extends Distribution<S, D>> MixtureModel<S, D> statistics(MixtureModel<S, D> model, List<S> samples) {
        int components = model.size();
        int n = samples.size();
        double[][] responsibilities = new double[components][n];
        for (int i = 0; i < n; i++) {
            double[] r = model.responsibilities(samples.get(i));
            for (int k = 0; k < components; k++) {
                responsibilities[k][i] = r[k];
            }
        }

        double[] weights = new double[components];
        List<D> distributions = new ArrayList<>(components);
        for (int k = 0; k < components; k++) {
            weights[k] = MathUtils.sum(responsibilities[k]) / n;
            distributions.add(model.distributions().get(k).summarize(responsibilities[k], samples));
        }
        return new MixtureModel<>(weights, distributions);
    }

    /**
     * Read the model off a summary. A component whose summary weight vanished keeps its previous
     * distribution.
     */
    static <S, D extends Distribution<S, D>> MixtureModel<S, D> maximize(MixtureModel<S, D> summary,
                                                                       MixtureModel<S, D> previous) {
        double[] weights = MathUtils.normalize(summary.weights());
        List<D> distributions = new ArrayList<>(summary.size());
        for (int k = 0; k < summary.size(); k++) {
            double w = summary.weights()[k];
            distributions.add(w > 0.0 ? summary.distributions().get(k).scale(1.0 / w) : previous.distributions().get(k));
        }
        return new MixtureModel<>(weights, distributions);
    }

    static <S, D extends Distribution<S, D>> double meanLoglikelihood(MixtureModel<S, D> model, List<S> samples) {
        double total = 0.0;
        for (S sample : samples) {
            total += model.loglikelihood(sample);
        }
        return total / samples.size();
    }
}
