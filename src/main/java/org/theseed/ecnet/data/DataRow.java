/**
 *
 */
package org.theseed.ecnet.data;

import java.util.Arrays;

/**
 * This object represents a single sample in a dataset.  It contains the sample ID, the input values and the
 * output values (each in the column order of the owning dataset), and the assignment string from the data
 * source, if any.  The assignment is only interpreted when the dataset is partitioned explicitly.
 *
 * Rows are immutable.  The value arrays are copied on the way in and on the way out.
 *
 * @author Bruce Parrello
 *
 */
public class DataRow {

    // FIELDS
    /** sample ID */
    private final String id;
    /** input values */
    private final double[] inputs;
    /** output values */
    private final double[] outputs;
    /** assignment string from the data source, or NULL if none */
    private final String assignment;

    /**
     * Construct a data row with no assignment.
     *
     * @param id		sample ID
     * @param inputs	input values
     * @param outputs	output values
     */
    public DataRow(String id, double[] inputs, double[] outputs) {
        this(id, inputs, outputs, null);
    }

    /**
     * Construct a data row.
     *
     * @param id			sample ID
     * @param inputs		input values
     * @param outputs		output values
     * @param assignment	partition assignment string, or NULL if none
     */
    public DataRow(String id, double[] inputs, double[] outputs, String assignment) {
        this.id = id;
        this.inputs = inputs.clone();
        this.outputs = outputs.clone();
        this.assignment = assignment;
    }

    /**
     * @return the sample ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return a copy of the input values
     */
    public double[] getInputs() {
        return this.inputs.clone();
    }

    /**
     * @return a copy of the output values
     */
    public double[] getOutputs() {
        return this.outputs.clone();
    }

    /**
     * @return the input value at the specified position
     *
     * @param idx	index of the desired input column
     */
    public double getInput(int idx) {
        return this.inputs[idx];
    }

    /**
     * @return the output value at the specified position
     *
     * @param idx	index of the desired output column
     */
    public double getOutput(int idx) {
        return this.outputs[idx];
    }

    /**
     * @return the number of input values
     */
    public int inputWidth() {
        return this.inputs.length;
    }

    /**
     * @return the number of output values
     */
    public int outputWidth() {
        return this.outputs.length;
    }

    /**
     * @return the assignment string, or NULL if there is none
     */
    public String getAssignment() {
        return this.assignment;
    }

    @Override
    public String toString() {
        return this.id + " " + Arrays.toString(this.inputs) + " -> " + Arrays.toString(this.outputs);
    }

}
