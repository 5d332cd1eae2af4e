package io.depinfer.config;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.depinfer.reduce.ReductionOptions;
import io.depinfer.regression.CrossValidatedLasso;
import io.depinfer.regression.PenaltyRule;
import io.depinfer.regression.RegressionEnsemble;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON-serializable configuration for a full depinfer run.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "transform": true,          // Kd input: apply -log10 and arctan transform
 *   "dedupe": true,             // collapse highly similar proteins
 *   "keep_targets": ["BTK"],    // proteins that must stay as columns
 *   "cutoff": 0.8,              // cosine similarity cutoff for grouping
 *   "repeats": 100,             // independent cross-validated fits
 *   "folds": 3,                 // cross-validation folds per fit
 *   "penalty_rule": "lambda.min",
 *   "parallelism": 4,           // worker threads, default all processors
 *   "seed": 42                  // optional base seed for fold assignment
 * }
 * }</pre>
 *
 * <p>Absent fields take the defaults shown above, except {@code parallelism}
 * and {@code seed}, which default to unset.
 */
public class DepInferConfig {

    public static final int DEFAULT_REPEATS = 100;

    @SerializedName("transform")
    private Boolean transform;

    @SerializedName("dedupe")
    private Boolean dedupe;

    @SerializedName("keep_targets")
    private List<String> keepTargets;

    @SerializedName("cutoff")
    private Double cutoff;

    @SerializedName("repeats")
    private Integer repeats;

    @SerializedName("folds")
    private Integer folds;

    @SerializedName("penalty_rule")
    private String penaltyRule;

    @SerializedName("parallelism")
    private Integer parallelism;

    @SerializedName("seed")
    private Long seed;

    /**
     * Creates a configuration with every option at its default.
     */
    public DepInferConfig() {
    }

    /**
     * Parses a configuration from JSON and validates it.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is out of range
     */
    public static DepInferConfig fromJson(String json) {
        DepInferConfig config;
        try {
            config = DepInferGsonConfig.gson().fromJson(json, DepInferConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new IllegalArgumentException("Configuration JSON is empty");
        }
        config.validate();
        return config;
    }

    /**
     * Loads and validates a configuration file.
     */
    public static DepInferConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DepInferConfig config;
            try {
                config = DepInferGsonConfig.gson().fromJson(reader, DepInferConfig.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("Invalid configuration file " + path + ": " + e.getMessage(), e);
            }
            if (config == null) {
                throw new IllegalArgumentException("Configuration file is empty: " + path);
            }
            config.validate();
            return config;
        }
    }

    public String toJson() {
        return DepInferGsonConfig.gson().toJson(this);
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            DepInferGsonConfig.gson().toJson(this, writer);
        }
    }

    /**
     * Checks all set values.
     *
     * @throws IllegalArgumentException naming the first invalid option
     */
    public void validate() {
        if (cutoff != null && (cutoff.isNaN() || cutoff < 0.0 || cutoff > 1.0)) {
            throw new IllegalArgumentException("cutoff must be in [0, 1], got " + cutoff);
        }
        if (repeats != null && repeats < 1) {
            throw new IllegalArgumentException("repeats must be a positive integer, got " + repeats);
        }
        if (folds != null && folds < CrossValidatedLasso.MIN_FOLDS) {
            throw new IllegalArgumentException("folds must be at least " + CrossValidatedLasso.MIN_FOLDS
                + ", got " + folds);
        }
        if (parallelism != null && parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        if (penaltyRule != null) {
            PenaltyRule.fromLabel(penaltyRule);
        }
        if (keepTargets != null && keepTargets.contains(null)) {
            throw new IllegalArgumentException("keep_targets cannot contain null");
        }
    }

    /**
     * Returns the pre-processing options described by this configuration.
     */
    public ReductionOptions reductionOptions() {
        return new ReductionOptions(isTransform(), isDedupe(), getKeepTargets(), getCutoff());
    }

    public boolean isTransform() {
        return transform == null || transform;
    }

    public DepInferConfig setTransform(boolean transform) {
        this.transform = transform;
        return this;
    }

    public boolean isDedupe() {
        return dedupe == null || dedupe;
    }

    public DepInferConfig setDedupe(boolean dedupe) {
        this.dedupe = dedupe;
        return this;
    }

    public List<String> getKeepTargets() {
        return keepTargets == null ? List.of() : List.copyOf(keepTargets);
    }

    public DepInferConfig setKeepTargets(List<String> keepTargets) {
        this.keepTargets = keepTargets == null ? null : new ArrayList<>(keepTargets);
        return this;
    }

    public double getCutoff() {
        return cutoff == null ? ReductionOptions.DEFAULT_CUTOFF : cutoff;
    }

    public DepInferConfig setCutoff(double cutoff) {
        this.cutoff = cutoff;
        return this;
    }

    public int getRepeats() {
        return repeats == null ? DEFAULT_REPEATS : repeats;
    }

    public DepInferConfig setRepeats(int repeats) {
        this.repeats = repeats;
        return this;
    }

    public int getFolds() {
        return folds == null ? RegressionEnsemble.DEFAULT_FOLDS : folds;
    }

    public DepInferConfig setFolds(int folds) {
        this.folds = folds;
        return this;
    }

    public PenaltyRule getPenaltyRule() {
        return penaltyRule == null ? PenaltyRule.MIN_ERROR : PenaltyRule.fromLabel(penaltyRule);
    }

    public DepInferConfig setPenaltyRule(PenaltyRule rule) {
        this.penaltyRule = rule.label();
        return this;
    }

    /**
     * Returns the configured worker count, or null to use the default.
     */
    public Integer getParallelism() {
        return parallelism;
    }

    public DepInferConfig setParallelism(Integer parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public DepInferConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }
}
