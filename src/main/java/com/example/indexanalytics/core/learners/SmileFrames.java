package com.example.indexanalytics.core.learners;

import smile.data.DataFrame;
import smile.data.formula.Formula;

import java.util.List;

/**
 * Builds Smile data frames with the target in a trailing {@code y} column.
 */
final class SmileFrames {

    static final String TARGET = "y";
    static final Formula FORMULA = Formula.lhs(TARGET);

    private SmileFrames() {
    }

    static DataFrame training(double[][] features, double[] target, List<String> featureNames) {
        double[][] data = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            data[i] = withTarget(features[i], target[i]);
        }
        return DataFrame.of(data, columnNames(featureNames));
    }

    /**
     * Rows for prediction carry a zero target so the frame matches the training schema.
     */
    static DataFrame query(double[][] rows, List<String> featureNames) {
        double[][] data = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            data[i] = withTarget(rows[i], 0.0);
        }
        return DataFrame.of(data, columnNames(featureNames));
    }

    private static double[] withTarget(double[] row, double target) {
        double[] result = new double[row.length + 1];
        System.arraycopy(row, 0, result, 0, row.length);
        result[row.length] = target;
        return result;
    }

    private static String[] columnNames(List<String> featureNames) {
        String[] names = new String[featureNames.size() + 1];
        for (int i = 0; i < featureNames.size(); i++) {
            names[i] = featureNames.get(i);
        }
        names[featureNames.size()] = TARGET;
        return names;
    }
}
