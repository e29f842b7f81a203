/**
 *
 */
package org.theseed.ecnet.metrics;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.theseed.ecnet.EcnetException;

/**
 * This is a utility class for computing error statistics from a predicted and an actual sequence of values.
 * Only static methods are provided, and none of them has side effects.  The matrix forms treat the
 * matrices as a single sequence in row-major order, so a model with several outputs gets one combined
 * figure.
 *
 * @author Bruce Parrello
 *
 */
public class ErrorMetrics {

    /**
     * @return the root-mean-square error between the predicted and actual values
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    public static double rmse(double[] predicted, double[] actual) {
        checkInputs(predicted, actual);
        double total = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double diff = predicted[i] - actual[i];
            total += diff * diff;
        }
        return Math.sqrt(total / actual.length);
    }

    /**
     * @return the root-mean-square error between the predicted and actual matrices
     *
     * @param predicted		predicted values, one row per sample
     * @param actual		actual values, one row per sample
     */
    public static double rmse(double[][] predicted, double[][] actual) {
        return rmse(flatten(predicted, actual), flatten(actual, predicted));
    }

    /**
     * @return the mean absolute error between the predicted and actual values
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    public static double meanAbsoluteError(double[] predicted, double[] actual) {
        double[] errors = absoluteErrors(predicted, actual);
        double total = 0.0;
        for (double error : errors)
            total += error;
        return total / errors.length;
    }

    /**
     * @return the mean absolute error between the predicted and actual matrices
     *
     * @param predicted		predicted values, one row per sample
     * @param actual		actual values, one row per sample
     */
    public static double meanAbsoluteError(double[][] predicted, double[][] actual) {
        return meanAbsoluteError(flatten(predicted, actual), flatten(actual, predicted));
    }

    /**
     * @return the median absolute error between the predicted and actual values
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    public static double medianAbsoluteError(double[] predicted, double[] actual) {
        double[] errors = absoluteErrors(predicted, actual);
        // The commons median interpolates between the two middle values for an even count.
        return new Median().evaluate(errors);
    }

    /**
     * @return the median absolute error between the predicted and actual matrices
     *
     * @param predicted		predicted values, one row per sample
     * @param actual		actual values, one row per sample
     */
    public static double medianAbsoluteError(double[][] predicted, double[][] actual) {
        return medianAbsoluteError(flatten(predicted, actual), flatten(actual, predicted));
    }

    /**
     * Compute the coefficient of determination.  If the actual values are all the same, the coefficient
     * is 1.0 for a perfect prediction and undefined otherwise.
     *
     * @param predicted		predicted values
     * @param actual		actual values
     *
     * @return the R-squared value for the prediction
     *
     * @throws EcnetException if the actual values are constant and the prediction is not exact
     */
    public static double rSquared(double[] predicted, double[] actual) {
        checkInputs(predicted, actual);
        double ssRes = residualSquares(predicted, actual);
        double ssTot = totalSquares(actual);
        double retVal;
        if (ssTot > 0.0)
            retVal = 1.0 - ssRes / ssTot;
        else if (ssRes == 0.0)
            retVal = 1.0;
        else
            throw new EcnetException(EcnetException.Type.UNDEFINED_METRIC,
                    "R-squared is undefined when all actual values are equal and the prediction is not exact.");
        return retVal;
    }

    /**
     * @return the R-squared value for predicted and actual matrices
     *
     * @param predicted		predicted values, one row per sample
     * @param actual		actual values, one row per sample
     */
    public static double rSquared(double[][] predicted, double[][] actual) {
        return rSquared(flatten(predicted, actual), flatten(actual, predicted));
    }

    /**
     * @return TRUE if {@link #rSquared(double[], double[])} will return a value for these inputs, FALSE
     * 		   if it would report an undefined metric
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    public static boolean isRSquaredDefined(double[] predicted, double[] actual) {
        checkInputs(predicted, actual);
        return totalSquares(actual) > 0.0 || residualSquares(predicted, actual) == 0.0;
    }

    /**
     * @return the sum of the squared differences between predicted and actual values
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    private static double residualSquares(double[] predicted, double[] actual) {
        double retVal = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double diff = predicted[i] - actual[i];
            retVal += diff * diff;
        }
        return retVal;
    }

    /**
     * @return the sum of the squared differences between the actual values and their mean
     *
     * @param actual		actual values
     */
    private static double totalSquares(double[] actual) {
        double mean = 0.0;
        for (double value : actual)
            mean += value;
        mean /= actual.length;
        double retVal = 0.0;
        for (double value : actual) {
            double diff = value - mean;
            retVal += diff * diff;
        }
        return retVal;
    }

    /**
     * @return an array of the absolute differences between predicted and actual values
     *
     * @param predicted		predicted values
     * @param actual		actual values
     */
    private static double[] absoluteErrors(double[] predicted, double[] actual) {
        checkInputs(predicted, actual);
        double[] retVal = new double[actual.length];
        for (int i = 0; i < actual.length; i++)
            retVal[i] = Math.abs(predicted[i] - actual[i]);
        return retVal;
    }

    /**
     * Verify that two value sequences can be compared.
     *
     * @param predicted		predicted values
     * @param actual		actual values
     *
     * @throws EcnetException if the lengths differ or either sequence is empty
     */
    private static void checkInputs(double[] predicted, double[] actual) {
        if (predicted.length != actual.length)
            throw new EcnetException(EcnetException.Type.DIMENSION_MISMATCH,
                    String.format("Predicted sequence has %d values but actual sequence has %d.",
                            predicted.length, actual.length));
        if (actual.length == 0)
            throw new EcnetException(EcnetException.Type.EMPTY_INPUT, "Cannot compute an error metric over zero values.");
    }

    /**
     * Convert a matrix to a single row-major array, verifying that its shape matches a partner matrix.
     *
     * @param matrix	matrix to flatten
     * @param partner	matrix it will be compared against
     *
     * @return the matrix values in row-major order
     *
     * @throws EcnetException if the two matrices do not have the same shape
     */
    private static double[] flatten(double[][] matrix, double[][] partner) {
        if (matrix.length != partner.length)
            throw new EcnetException(EcnetException.Type.DIMENSION_MISMATCH,
                    String.format("Matrix has %d rows but its partner has %d.", matrix.length, partner.length));
        int total = 0;
        for (int r = 0; r < matrix.length; r++) {
            if (matrix[r].length != partner[r].length)
                throw new EcnetException(EcnetException.Type.DIMENSION_MISMATCH,
                        String.format("Row %d has %d values but its partner has %d.", r, matrix[r].length,
                                partner[r].length));
            total += matrix[r].length;
        }
        double[] retVal = new double[total];
        int pos = 0;
        for (double[] row : matrix) {
            System.arraycopy(row, 0, retVal, pos, row.length);
            pos += row.length;
        }
        return retVal;
    }

}
