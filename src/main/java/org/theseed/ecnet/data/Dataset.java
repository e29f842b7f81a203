/**
 *
 */
package org.theseed.ecnet.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.theseed.ecnet.EcnetException;

/**
 * A dataset is an ordered list of samples.  Each sample has the same named input columns and the same named
 * output columns.  The dataset is immutable:  operations that select rows or columns return a new dataset.
 *
 * @author Bruce Parrello
 *
 */
public class Dataset {

    // FIELDS
    /** names of the input columns */
    private final List<String> inputNames;
    /** names of the output columns */
    private final List<String> outputNames;
    /** samples in this dataset */
    private final List<DataRow> rows;

    /**
     * Construct a dataset.
     *
     * @param inputNames	names of the input columns
     * @param outputNames	names of the output columns
     * @param rows			samples to store
     *
     * @throws IllegalArgumentException if the column names are not unique or a row has the wrong width
     */
    public Dataset(List<String> inputNames, List<String> outputNames, List<DataRow> rows) {
        this.inputNames = List.copyOf(inputNames);
        this.outputNames = List.copyOf(outputNames);
        Set<String> names = new HashSet<String>(inputNames);
        names.addAll(outputNames);
        if (names.size() != inputNames.size() + outputNames.size())
            throw new IllegalArgumentException("Column names in a dataset must be unique.");
        for (DataRow row : rows) {
            if (row.inputWidth() != this.inputNames.size() || row.outputWidth() != this.outputNames.size())
                throw new IllegalArgumentException(String.format("Row %s has %d inputs and %d outputs, but %d and %d are required.",
                        row.getId(), row.inputWidth(), row.outputWidth(), this.inputNames.size(), this.outputNames.size()));
        }
        this.rows = Collections.unmodifiableList(new ArrayList<DataRow>(rows));
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.rows.size();
    }

    /**
     * @return TRUE if there are no samples
     */
    public boolean isEmpty() {
        return this.rows.isEmpty();
    }

    /**
     * @return the names of the input columns
     */
    public List<String> getInputNames() {
        return this.inputNames;
    }

    /**
     * @return the names of the output columns
     */
    public List<String> getOutputNames() {
        return this.outputNames;
    }

    /**
     * @return the samples in this dataset
     */
    public List<DataRow> getRows() {
        return this.rows;
    }

    /**
     * @return the sample at the specified position
     *
     * @param idx	index of the desired sample
     */
    public DataRow getRow(int idx) {
        return this.rows.get(idx);
    }

    /**
     * @return all the values in the named column, in row order
     *
     * @param name	name of an input or output column
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] getColumn(String name) {
        double[] retVal = new double[this.rows.size()];
        int idx = this.inputNames.indexOf(name);
        if (idx >= 0) {
            for (int i = 0; i < retVal.length; i++)
                retVal[i] = this.rows.get(i).getInput(idx);
        } else {
            idx = this.outputNames.indexOf(name);
            if (idx < 0)
                throw new IllegalArgumentException("Column \"" + name + "\" is not in this dataset.");
            for (int i = 0; i < retVal.length; i++)
                retVal[i] = this.rows.get(i).getOutput(idx);
        }
        return retVal;
    }

    /**
     * @return a matrix of the input values, one row per sample
     */
    public double[][] getInputMatrix() {
        double[][] retVal = new double[this.rows.size()][];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = this.rows.get(i).getInputs();
        return retVal;
    }

    /**
     * @return a matrix of the output values, one row per sample
     */
    public double[][] getOutputMatrix() {
        double[][] retVal = new double[this.rows.size()][];
        for (int i = 0; i < retVal.length; i++)
            retVal[i] = this.rows.get(i).getOutputs();
        return retVal;
    }

    /**
     * Create a copy of this dataset restricted to the specified input columns.  The output columns are
     * unchanged.
     *
     * @param columns	names of the input columns to keep, in the desired order
     *
     * @return a new dataset with only the specified inputs
     *
     * @throws IllegalArgumentException if a column is not an input column
     */
    public Dataset selectInputs(List<String> columns) {
        int[] idxes = new int[columns.size()];
        for (int i = 0; i < idxes.length; i++) {
            idxes[i] = this.inputNames.indexOf(columns.get(i));
            if (idxes[i] < 0)
                throw new IllegalArgumentException("\"" + columns.get(i) + "\" is not an input column.");
        }
        List<DataRow> newRows = new ArrayList<DataRow>(this.rows.size());
        for (DataRow row : this.rows) {
            double[] inputs = new double[idxes.length];
            for (int i = 0; i < idxes.length; i++)
                inputs[i] = row.getInput(idxes[i]);
            newRows.add(new DataRow(row.getId(), inputs, row.getOutputs(), row.getAssignment()));
        }
        return new Dataset(columns, this.outputNames, newRows);
    }

    /**
     * @return a dataset containing the samples at the specified positions, in the order given
     *
     * @param idxes		indices of the samples to keep
     */
    public Dataset subset(int[] idxes) {
        List<DataRow> newRows = new ArrayList<DataRow>(idxes.length);
        for (int idx : idxes)
            newRows.add(this.rows.get(idx));
        return new Dataset(this.inputNames, this.outputNames, newRows);
    }

    /**
     * @return a list of the assignment strings for all the samples, in row order
     *
     * @throws EcnetException if a sample has no assignment
     */
    public List<String> getAssignments() {
        List<String> retVal = new ArrayList<String>(this.rows.size());
        for (DataRow row : this.rows) {
            String assignment = row.getAssignment();
            if (assignment == null)
                throw new EcnetException(EcnetException.Type.INVALID_LABEL, "Sample " + row.getId() + " has no assignment.");
            retVal.add(assignment);
        }
        return retVal;
    }

}
