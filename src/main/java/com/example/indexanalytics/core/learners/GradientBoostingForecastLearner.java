package com.example.indexanalytics.core.learners;

import com.example.indexanalytics.common.model.LearnerCapability;
import lombok.RequiredArgsConstructor;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

import java.util.List;
import java.util.Properties;

@RequiredArgsConstructor
public class GradientBoostingForecastLearner implements ForecastLearner {

    private final int trees;
    private final int maxDepth;
    private final double shrinkage;
    private final long seed;

    @Override
    public LearnerCapability getCapability() {
        return LearnerCapability.GRADIENT_BOOSTING;
    }

    @Override
    public FittedModel fit(double[][] features, double[] target, List<String> featureNames) {
        Properties params = new Properties();
        params.setProperty("smile.gbt.trees", String.valueOf(trees));
        params.setProperty("smile.gbt.max.depth", String.valueOf(maxDepth));
        params.setProperty("smile.gbt.shrinkage", String.valueOf(shrinkage));
        params.setProperty("smile.gbt.sample.rate", "0.8");
        // Smile keeps one generator per thread; only the calling thread's generator is reseeded.
        MathEx.setSeed(seed);
        GradientTreeBoost boost = GradientTreeBoost.fit(SmileFrames.FORMULA, SmileFrames.training(features, target, featureNames), params);
        return new FittedModel() {
            @Override
            public double predict(double[] row) {
                return predictAll(new double[][]{row})[0];
            }

            @Override
            public double[] predictAll(double[][] rows) {
                return boost.predict(SmileFrames.query(rows, featureNames));
            }
        };
    }
}
