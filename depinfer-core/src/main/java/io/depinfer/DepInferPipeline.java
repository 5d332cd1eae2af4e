package io.depinfer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.depinfer.aggregate.ResultAggregator;
import io.depinfer.config.DepInferConfig;
import io.depinfer.model.AffinityMatrix;
import io.depinfer.model.AggregatedResult;
import io.depinfer.model.MatrixValidation;
import io.depinfer.model.RawRepeatResult;
import io.depinfer.model.ResponseMatrix;
import io.depinfer.model.TargetReduction;
import io.depinfer.reduce.ReductionOptions;
import io.depinfer.reduce.SimilarityReducer;
import io.depinfer.regression.RegressionEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for inferring per-sample protein dependencies.
 *
 * <pre>{@code
 * Kd matrix ──► processTargets ──► target matrix + groups
 *                                        │
 * response matrix ───────────────────────┤
 *                                        ▼
 *                               runLassoRegression
 *                          (ensemble ──► aggregation)
 *                                        │
 *                                        ▼
 *                                AggregatedResult
 * }</pre>
 *
 * <p>The pipeline owns a {@link RegressionEnsemble} built from its configuration
 * and must be closed to release the worker pool.
 *
 * <pre>{@code
 * DepInferConfig config = DepInferConfig.load(Path.of("depinfer.json"));
 * try (DepInferPipeline pipeline = new DepInferPipeline(config)) {
 *     AggregatedResult result = pipeline.run(kdMatrix, responses);
 * }
 * }</pre>
 */
public final class DepInferPipeline implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DepInferPipeline.class);

    private final DepInferConfig config;
    private final SimilarityReducer reducer;
    private final RegressionEnsemble ensemble;
    private final boolean ownsEnsemble;
    private final ResultAggregator aggregator;

    /**
     * Creates a pipeline with every option at its default.
     */
    public DepInferPipeline() {
        this(new DepInferConfig());
    }

    public DepInferPipeline(DepInferConfig config) {
        this(config, ensembleFor(config), true);
    }

    /**
     * Creates a pipeline around a caller-built ensemble. The ensemble's own
     * settings take precedence over the regression options of the configuration.
     * {@link #close()} leaves the ensemble open.
     */
    public DepInferPipeline(DepInferConfig config, RegressionEnsemble ensemble) {
        this(config, ensemble, false);
    }

    private DepInferPipeline(DepInferConfig config, RegressionEnsemble ensemble, boolean ownsEnsemble) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.config.validate();
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble cannot be null");
        this.ownsEnsemble = ownsEnsemble;
        this.reducer = new SimilarityReducer();
        this.aggregator = new ResultAggregator();
    }

    private static RegressionEnsemble ensembleFor(DepInferConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        RegressionEnsemble.Builder builder = RegressionEnsemble.builder()
            .folds(config.getFolds())
            .penaltyRule(config.getPenaltyRule())
            .seed(config.getSeed());
        if (config.getParallelism() != null) {
            builder.parallelism(config.getParallelism());
        }
        return builder.build();
    }

    /**
     * Pre-processes an affinity matrix with the configured options.
     */
    public TargetReduction processTargets(AffinityMatrix targets) {
        return processTargets(targets, config.reductionOptions());
    }

    /**
     * Pre-processes an affinity matrix: optional Kd transform and optional
     * similarity reduction.
     */
    public TargetReduction processTargets(AffinityMatrix targets, ReductionOptions options) {
        return reducer.reduce(targets, options);
    }

    /**
     * Runs the configured number of repeats and aggregates them.
     */
    public AggregatedResult runLassoRegression(AffinityMatrix targets, ResponseMatrix responses) {
        return runLassoRegression(targets, responses, config.getRepeats());
    }

    /**
     * Runs {@code repeats} cross-validated lasso fits of the responses against the
     * processed targets and aggregates them.
     *
     * @throws IllegalArgumentException for invalid input, before any fitting
     * @throws io.depinfer.regression.SolverException if any repeat fails
     */
    public AggregatedResult runLassoRegression(AffinityMatrix targets, ResponseMatrix responses, int repeats) {
        List<RawRepeatResult> results = ensemble.runEnsemble(targets, responses, repeats);
        return aggregator.aggregate(results, targets, responses);
    }

    /**
     * Pre-processes the Kd matrix and fits the responses against it.
     *
     * <p>Drug alignment and the repeat count are checked before any work.
     */
    public AggregatedResult run(AffinityMatrix kdMatrix, ResponseMatrix responses) {
        MatrixValidation.requireAlignedDrugs(kdMatrix, responses);
        MatrixValidation.requirePositiveRepeats(config.getRepeats());
        TargetReduction reduction = processTargets(kdMatrix);
        logger.info("Fitting {} samples against {} target columns ({} merged groups)",
            responses.columns(), reduction.targetMatrix().columns(), reduction.mergedGroups().size());
        return runLassoRegression(reduction.targetMatrix(), responses);
    }

    public DepInferConfig getConfig() {
        return config;
    }

    /**
     * Closes the ensemble if this pipeline created it.
     */
    @Override
    public void close() {
        if (ownsEnsemble) {
            ensemble.close();
        }
    }
}
