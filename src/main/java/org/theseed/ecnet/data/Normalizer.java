/**
 *
 */
package org.theseed.ecnet.data;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.EcnetException;

/**
 * This class performs min-max normalization.  Each normalized column is mapped so that its minimum becomes
 * 0 and its maximum becomes 1.  A constant column cannot be rescaled, so every value in it becomes 0.5.
 * Values outside the fitted range are not clamped, which keeps the mapping invertible.
 *
 * Only static methods are provided.
 *
 * @author Bruce Parrello
 *
 */
public class Normalizer {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Normalizer.class);

    /** normalized value for a constant column */
    public static final double DEGENERATE_VALUE = 0.5;

    /**
     * Compute the normalization parameters for the specified columns.
     *
     * @param dataset	dataset to scan (usually the learning set)
     * @param columns	names of the columns to normalize
     *
     * @return the minimum and maximum of each column
     *
     * @throws EcnetException if the dataset is empty
     */
    public static NormalizationParameters computeParameters(Dataset dataset, List<String> columns) {
        if (dataset.isEmpty())
            throw new EcnetException(EcnetException.Type.EMPTY_INPUT, "Cannot compute normalization parameters from an empty dataset.");
        NormalizationParameters retVal = new NormalizationParameters();
        for (String column : columns) {
            double[] values = dataset.getColumn(column);
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double value : values) {
                if (value < min) min = value;
                if (value > max) max = value;
            }
            retVal.put(column, min, max);
            if (min == max)
                log.warn("Column \"{}\" is constant at {}.", column, min);
        }
        return retVal;
    }

    /**
     * Compute the normalization parameters for all the input and output columns.
     *
     * @param dataset	dataset to scan (usually the learning set)
     *
     * @return the minimum and maximum of each column
     */
    public static NormalizationParameters computeParameters(Dataset dataset) {
        List<String> columns = new ArrayList<String>(dataset.getInputNames());
        columns.addAll(dataset.getOutputNames());
        return computeParameters(dataset, columns);
    }

    /**
     * Normalize a dataset.  Columns without parameters are copied unchanged.
     *
     * @param dataset	dataset to normalize
     * @param params	normalization parameters
     *
     * @return a new, normalized dataset
     */
    public static Dataset normalize(Dataset dataset, NormalizationParameters params) {
        NormalizationParameters.Range[] inRanges = rangesFor(dataset.getInputNames(), params);
        NormalizationParameters.Range[] outRanges = rangesFor(dataset.getOutputNames(), params);
        List<DataRow> rows = new ArrayList<DataRow>(dataset.size());
        for (DataRow row : dataset.getRows()) {
            double[] inputs = row.getInputs();
            rescale(inputs, inRanges);
            double[] outputs = row.getOutputs();
            rescale(outputs, outRanges);
            rows.add(new DataRow(row.getId(), inputs, outputs, row.getAssignment()));
        }
        return new Dataset(dataset.getInputNames(), dataset.getOutputNames(), rows);
    }

    /**
     * @return the normalized form of a single value
     *
     * @param value		value to normalize
     * @param params	normalization parameters
     * @param column	name of the value's column
     */
    public static double normalize(double value, NormalizationParameters params, String column) {
        return normalize(value, params.require(column));
    }

    /**
     * @return the original value corresponding to a normalized value
     *
     * @param value		normalized value
     * @param params	normalization parameters
     * @param column	name of the value's column
     */
    public static double denormalize(double value, NormalizationParameters params, String column) {
        NormalizationParameters.Range range = params.require(column);
        double retVal;
        if (range.isDegenerate())
            retVal = range.getMin();
        else
            retVal = value * (range.getMax() - range.getMin()) + range.getMin();
        return retVal;
    }

    /**
     * Convert a matrix of normalized values back to the original scale.  This is normally used on predicted
     * outputs.
     *
     * @param matrix	normalized values, one row per sample
     * @param params	normalization parameters
     * @param columns	names of the matrix columns
     *
     * @return a new matrix of denormalized values
     */
    public static double[][] denormalize(double[][] matrix, NormalizationParameters params, List<String> columns) {
        double[][] retVal = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            retVal[r] = new double[matrix[r].length];
            for (int c = 0; c < matrix[r].length; c++) {
                String column = columns.get(c);
                if (params.contains(column))
                    retVal[r][c] = denormalize(matrix[r][c], params, column);
                else
                    retVal[r][c] = matrix[r][c];
            }
        }
        return retVal;
    }

    /**
     * @return the normalized form of a value in the specified range
     *
     * @param value		value to normalize
     * @param range		range of the value's column
     */
    private static double normalize(double value, NormalizationParameters.Range range) {
        double retVal;
        if (range.isDegenerate())
            retVal = DEGENERATE_VALUE;
        else
            retVal = (value - range.getMin()) / (range.getMax() - range.getMin());
        return retVal;
    }

    /**
     * @return an array of the ranges for the specified columns, with NULL for a column that is not normalized
     *
     * @param columns	column names
     * @param params	normalization parameters
     */
    private static NormalizationParameters.Range[] rangesFor(List<String> columns, NormalizationParameters params) {
        NormalizationParameters.Range[] retVal = new NormalizationParameters.Range[columns.size()];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = params.get(columns.get(i));
        return retVal;
    }

    /**
     * Normalize an array of values in place.
     *
     * @param values	values to normalize
     * @param ranges	range for each value, or NULL if the value should be left alone
     */
    private static void rescale(double[] values, NormalizationParameters.Range[] ranges) {
        for (int i = 0; i < values.length; i++) {
            if (ranges[i] != null)
                values[i] = normalize(values[i], ranges[i]);
        }
    }

}
