/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */
package com.amazon.rpsestimator.predictor;

import static com.amazon.rpsestimator.CommonUtils.allFinite;
import static com.amazon.rpsestimator.CommonUtils.checkNotNull;
import static com.amazon.rpsestimator.CommonUtils.checkState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.rpsestimator.baseline.BaselineDecomposer;
import com.amazon.rpsestimator.baseline.BaselineSeries;
import com.amazon.rpsestimator.features.FeatureEngineer;
import com.amazon.rpsestimator.features.FeatureFrame;
import com.amazon.rpsestimator.features.FeatureRow;
import com.amazon.rpsestimator.input.EventRecord;
import com.amazon.rpsestimator.input.PreconditionException;
import com.amazon.rpsestimator.input.TimeFieldResolver;
import com.amazon.rpsestimator.model.IRegressionModel;
import com.amazon.rpsestimator.model.ModelArtifact;
import com.amazon.rpsestimator.rate.RateBuilder;
import com.amazon.rpsestimator.rate.RatePoint;
import com.amazon.rpsestimator.rate.RateSeries;
import com.amazon.rpsestimator.schema.FeatureSchema;
import com.amazon.rpsestimator.schema.FeatureSchemaResolver;
import com.amazon.rpsestimator.schema.SchemaMismatchException;

/**
 * Runs raw events through rate bucketing, baseline decomposition and feature
 * engineering, then predicts with a base model plus an optional
 * residual-correction model.
 *
 * The models and the feature schema are fixed at construction; the schema is
 * resolved once from the base model artifact. Instances hold no mutable state,
 * so concurrent calls over independent batches need no coordination.
 *
 * Predictions are emitted only for intervals that survive feature engineering;
 * the first {@link FeatureEngineer#LOOKBACK} intervals of every batch have no
 * prediction.
 */
@Slf4j
@Getter
public class EnsemblePredictor {

    private final ModelArtifact baseArtifact;

    private final ModelArtifact residualArtifact;

    @Getter(AccessLevel.NONE)
    private final FeatureSchema schema;

    private final TimeFieldResolver timeFieldResolver;

    private final RateBuilder rateBuilder;

    private final BaselineDecomposer baselineDecomposer;

    private final FeatureEngineer featureEngineer;

    protected EnsemblePredictor(Builder builder) {
        this.baseArtifact = builder.baseArtifact;
        this.residualArtifact = builder.residualArtifact;
        this.timeFieldResolver = checkNotNull(builder.timeFieldResolver, "time field resolver cannot be null");
        this.rateBuilder = checkNotNull(builder.rateBuilder, "rate builder cannot be null");
        this.baselineDecomposer = checkNotNull(builder.baselineDecomposer, "baseline decomposer cannot be null");
        this.featureEngineer = checkNotNull(builder.featureEngineer, "feature engineer cannot be null");
        if (baseArtifact == null) {
            log.warn("Base model is missing; predictions will be zero");
            this.schema = null;
        } else if (builder.schema != null) {
            this.schema = builder.schema;
        } else {
            this.schema = checkNotNull(builder.schemaResolver, "schema resolver cannot be null")
                    .resolve(baseArtifact);
        }
        if (residualArtifact == null) {
            log.info("No residual model loaded; predictions use the base model only");
        }
    }

    public Optional<FeatureSchema> getFeatureSchema() {
        return Optional.ofNullable(schema);
    }

    public boolean hasBaseModel() {
        return baseArtifact != null;
    }

    public boolean hasResidualModel() {
        return residualArtifact != null;
    }

    /**
     * predicts for a batch of uploaded records
     *
     * @param records the batch; only the time field of each record is read
     * @return the prediction series
     * @throws PreconditionException   if the batch has no usable time field
     * @throws SchemaMismatchException if the engineered features do not cover
     *                                 the schema
     */
    public PredictionResult predict(List<EventRecord> records) {
        checkNotNull(records, "records cannot be null");
        return predictTimestamps(timeFieldResolver.extractTimestamps(records));
    }

    /**
     * predicts for a batch of event timestamps
     *
     * @param timestamps event times, in any order
     * @return the prediction series
     */
    public PredictionResult predictTimestamps(List<Instant> timestamps) {
        checkNotNull(timestamps, "timestamps cannot be null");
        RateSeries rates = rateBuilder.build(timestamps);
        if (baseArtifact == null) {
            return zeroPredictions(timestamps, rates);
        }
        BaselineSeries baseline = baselineDecomposer.decompose(rates);
        FeatureFrame frame = featureEngineer.engineer(baseline);
        log.debug("Engineered {} of {} intervals", frame.size(), rates.size());
        return predict(frame);
    }

    /**
     * predicts for an already engineered frame
     *
     * @param frame the engineered features
     * @return one prediction row per frame row
     */
    public PredictionResult predict(FeatureFrame frame) {
        checkNotNull(frame, "frame cannot be null");
        checkState(baseArtifact != null, "no base model loaded");
        if (frame.isEmpty()) {
            log.debug("No interval has a full look-back window; returning an empty series");
            return new PredictionResult(Collections.emptyList(), PredictionMode.INSUFFICIENT_HISTORY);
        }
        schema.validate(frame.getColumns());
        double[][] matrix = frame.toMatrix(schema.getFeatureNames());

        double[] base = baseArtifact.getModel().predict(matrix);
        checkState(base != null && base.length == matrix.length, "base model returned "
                + ((base == null) ? "no" : base.length) + " predictions for " + matrix.length + " rows");

        PredictionMode mode = PredictionMode.BASE_ONLY;
        double[] correction = new double[matrix.length];
        if (residualArtifact != null) {
            try {
                double[] residual = residualArtifact.getModel().predict(matrix);
                checkState(residual != null && residual.length == matrix.length,
                        "residual model returned the wrong number of predictions");
                checkState(allFinite(residual), "residual model returned a non-finite prediction");
                correction = residual;
                mode = PredictionMode.FULL;
            } catch (RuntimeException e) {
                log.warn("Residual prediction failed for model {}, ignoring: {}", residualArtifact.getName(),
                        e.getMessage(), e);
                mode = PredictionMode.RESIDUAL_FAILED;
            }
        }

        List<PredictionRow> rows = new ArrayList<>(matrix.length);
        List<FeatureRow> featureRows = frame.getRows();
        for (int i = 0; i < matrix.length; i++) {
            FeatureRow featureRow = featureRows.get(i);
            rows.add(new PredictionRow(featureRow.getTimestamp(), featureRow.getRequestRate(), base[i],
                    clampToZero(base[i] + correction[i])));
        }
        return new PredictionResult(rows, mode);
    }

    /**
     * @return the value, or zero if it is negative or NaN
     */
    static double clampToZero(double value) {
        return (value > 0) ? value : 0;
    }

    /**
     * without a base model, one zero row per raw event, each labelled with the
     * request rate of its interval
     */
    PredictionResult zeroPredictions(List<Instant> timestamps, RateSeries rates) {
        List<Instant> sorted = new ArrayList<>(timestamps);
        Collections.sort(sorted);
        List<PredictionRow> rows = new ArrayList<>(sorted.size());
        if (!rates.isEmpty()) {
            long first = rates.get(0).getTimestamp().toEpochMilli();
            long width = rates.getIntervalWidth().toMillis();
            for (Instant timestamp : sorted) {
                long offset = rateBuilder.intervalStart(timestamp).toEpochMilli() - first;
                RatePoint point = rates.get((int) (offset / width));
                rows.add(new PredictionRow(timestamp, point.getRequestRate(), 0, 0));
            }
        }
        return new PredictionResult(rows, PredictionMode.NO_BASE_MODEL);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ModelArtifact baseArtifact;
        private ModelArtifact residualArtifact;
        private FeatureSchema schema;
        private FeatureSchemaResolver schemaResolver = new FeatureSchemaResolver();
        private TimeFieldResolver timeFieldResolver = new TimeFieldResolver();
        private RateBuilder rateBuilder = new RateBuilder();
        private BaselineDecomposer baselineDecomposer = new BaselineDecomposer();
        private FeatureEngineer featureEngineer = new FeatureEngineer();

        public Builder baseModel(ModelArtifact artifact) {
            this.baseArtifact = artifact;
            return this;
        }

        public Builder baseModel(IRegressionModel model) {
            this.baseArtifact = (model == null) ? null : new ModelArtifact("base", model);
            return this;
        }

        public Builder residualModel(ModelArtifact artifact) {
            this.residualArtifact = artifact;
            return this;
        }

        public Builder residualModel(IRegressionModel model) {
            this.residualArtifact = (model == null) ? null : new ModelArtifact("residual", model);
            return this;
        }

        /**
         * use this schema instead of resolving one from the base model
         */
        public Builder schema(FeatureSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder schemaResolver(FeatureSchemaResolver schemaResolver) {
            this.schemaResolver = schemaResolver;
            return this;
        }

        public Builder timeFieldResolver(TimeFieldResolver timeFieldResolver) {
            this.timeFieldResolver = timeFieldResolver;
            return this;
        }

        public Builder rateBuilder(RateBuilder rateBuilder) {
            this.rateBuilder = rateBuilder;
            return this;
        }

        public Builder baselineDecomposer(BaselineDecomposer baselineDecomposer) {
            this.baselineDecomposer = baselineDecomposer;
            return this;
        }

        public Builder featureEngineer(FeatureEngineer featureEngineer) {
            this.featureEngineer = featureEngineer;
            return this;
        }

        public EnsemblePredictor build() {
            return new EnsemblePredictor(this);
        }
    }
}
