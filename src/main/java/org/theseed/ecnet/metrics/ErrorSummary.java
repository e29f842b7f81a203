/**
 *
 */
package org.theseed.ecnet.metrics;

import java.util.Arrays;

import org.apache.commons.text.TextStringBuilder;

/**
 * This object holds the four error statistics for one comparison of predicted and actual values.  Unlike
 * {@link ErrorMetrics#rSquared(double[], double[])}, it never fails on constant actual values:  the
 * R-squared is stored as NaN and {@link #isRSquaredDefined()} returns FALSE.
 *
 * @author Bruce Parrello
 *
 */
public class ErrorSummary {

    // FIELDS
    /** root-mean-square error */
    private final double rmse;
    /** mean absolute error */
    private final double meanAbsError;
    /** median absolute error */
    private final double medianAbsError;
    /** coefficient of determination, or NaN if undefined */
    private final double rSquared;
    /** number of values compared */
    private final int count;

    /**
     * Compute the summary for a set of predictions.
     *
     * @param predicted		predicted values, one row per sample
     * @param actual		actual values, one row per sample
     */
    public ErrorSummary(double[][] predicted, double[][] actual) {
        this.rmse = ErrorMetrics.rmse(predicted, actual);
        this.meanAbsError = ErrorMetrics.meanAbsoluteError(predicted, actual);
        this.medianAbsError = ErrorMetrics.medianAbsoluteError(predicted, actual);
        // The matrices are known to be the same shape at this point.
        double[] flatPredicted = flatten(predicted);
        double[] flatActual = flatten(actual);
        if (ErrorMetrics.isRSquaredDefined(flatPredicted, flatActual))
            this.rSquared = ErrorMetrics.rSquared(flatPredicted, flatActual);
        else
            this.rSquared = Double.NaN;
        this.count = flatActual.length;
    }

    /**
     * @return the values of a matrix in row-major order
     *
     * @param matrix	matrix to flatten
     */
    private static double[] flatten(double[][] matrix) {
        return Arrays.stream(matrix).flatMapToDouble(Arrays::stream).toArray();
    }

    /**
     * @return the root-mean-square error
     */
    public double getRmse() {
        return this.rmse;
    }

    /**
     * @return the mean absolute error
     */
    public double getMeanAbsError() {
        return this.meanAbsError;
    }

    /**
     * @return the median absolute error
     */
    public double getMedianAbsError() {
        return this.medianAbsError;
    }

    /**
     * @return the coefficient of determination (NaN if it is undefined)
     */
    public double getRSquared() {
        return this.rSquared;
    }

    /**
     * @return TRUE if the coefficient of determination is defined for this data
     */
    public boolean isRSquaredDefined() {
        return ! Double.isNaN(this.rSquared);
    }

    /**
     * @return the number of values compared
     */
    public int getCount() {
        return this.count;
    }

    @Override
    public String toString() {
        TextStringBuilder retVal = new TextStringBuilder();
        retVal.appendln("%-24s %12d", "Values compared", this.count);
        retVal.appendln("%-24s %12.6g", "RMSE", this.rmse);
        retVal.appendln("%-24s %12.6g", "Mean absolute error", this.meanAbsError);
        retVal.appendln("%-24s %12.6g", "Median absolute error", this.medianAbsError);
        if (this.isRSquaredDefined())
            retVal.appendln("%-24s %12.6g", "R-squared", this.rSquared);
        else
            retVal.appendln("%-24s %12s", "R-squared", "undefined");
        return retVal.toString();
    }

}
