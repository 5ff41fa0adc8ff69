package com.trendscope.core.forecast.model;

import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;

/**
 * Converts feature rows to the data frames Smile's formula-based regressors
 * train on. Feature columns are named {@code x0}, {@code x1}, ... and the
 * target column {@value #TARGET}.
 */
final class SmileFrames {

    static final String TARGET = "y";
    static final Formula FORMULA = Formula.lhs(TARGET);

    private SmileFrames() {
        // utility class, not instantiable
    }

    static DataFrame of(double[][] rows, double[] targets) {
        int width = rows[0].length;
        double[][] data = new double[rows.length][width + 1];
        for (int i = 0; i < rows.length; i++) {
            System.arraycopy(rows[i], 0, data[i], 0, width);
            data[i][width] = targets[i];
        }
        return DataFrame.of(data, columns(width));
    }

    /** One row in the training schema; the target column is zero. */
    static Tuple row(double[] row) {
        return of(new double[][] { row }, new double[1]).get(0);
    }

    private static String[] columns(int width) {
        String[] names = new String[width + 1];
        for (int f = 0; f < width; f++) {
            names[f] = "x" + f;
        }
        names[width] = TARGET;
        return names;
    }
}
