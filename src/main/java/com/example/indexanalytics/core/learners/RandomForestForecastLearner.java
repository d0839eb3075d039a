package com.example.indexanalytics.core.learners;

import com.example.indexanalytics.common.model.LearnerCapability;
import lombok.RequiredArgsConstructor;
import smile.math.MathEx;
import smile.regression.RandomForest;

import java.util.List;
import java.util.Properties;

@RequiredArgsConstructor
public class RandomForestForecastLearner implements ForecastLearner {

    private final int trees;
    private final int maxDepth;
    private final long seed;

    @Override
    public LearnerCapability getCapability() {
        return LearnerCapability.RANDOM_FOREST;
    }

    @Override
    public FittedModel fit(double[][] features, double[] target, List<String> featureNames) {
        Properties params = new Properties();
        params.setProperty("smile.random.forest.trees", String.valueOf(trees));
        params.setProperty("smile.random.forest.max.depth", String.valueOf(maxDepth));
        params.setProperty("smile.random.forest.node.size", "5");
        // Smile keeps one generator per thread: this seeds the calling thread only, trees grown on
        // pool threads draw from their own generators.
        MathEx.setSeed(seed);
        RandomForest forest = RandomForest.fit(SmileFrames.FORMULA, SmileFrames.training(features, target, featureNames), params);
        return new FittedModel() {
            @Override
            public double predict(double[] row) {
                return predictAll(new double[][]{row})[0];
            }

            @Override
            public double[] predictAll(double[][] rows) {
                return forest.predict(SmileFrames.query(rows, featureNames));
            }
        };
    }
}
