/**
 *
 */
package org.theseed.ecnet.data;

import java.util.List;

/**
 * This object contains the three disjoint subsets produced by partitioning a dataset, along with the labels
 * that produced them.
 *
 * @author Bruce Parrello
 *
 */
public class Partition {

    // FIELDS
    /** learning subset */
    private final Dataset learn;
    /** validation subset */
    private final Dataset validation;
    /** testing subset */
    private final Dataset test;
    /** label for each row of the original dataset */
    private final PartitionLabel[] labels;

    /**
     * Construct a partition.
     *
     * @param learn			learning subset
     * @param validation	validation subset
     * @param test			testing subset
     * @param labels		label for each row of the original dataset
     */
    public Partition(Dataset learn, Dataset validation, Dataset test, PartitionLabel[] labels) {
        this.learn = learn;
        this.validation = validation;
        this.test = test;
        this.labels = labels.clone();
    }

    /**
     * @return the learning subset
     */
    public Dataset getLearn() {
        return this.learn;
    }

    /**
     * @return the validation subset
     */
    public Dataset getValidation() {
        return this.validation;
    }

    /**
     * @return the testing subset
     */
    public Dataset getTest() {
        return this.test;
    }

    /**
     * @return the subset for the specified label
     *
     * @param label		label of the desired subset
     */
    public Dataset get(PartitionLabel label) {
        Dataset retVal = null;
        switch (label) {
        case LEARN :
            retVal = this.learn;
            break;
        case VALIDATION :
            retVal = this.validation;
            break;
        case TEST :
            retVal = this.test;
            break;
        }
        return retVal;
    }

    /**
     * @return a copy of the label array
     */
    public PartitionLabel[] getLabels() {
        return this.labels.clone();
    }

    /**
     * Create a partition with the same rows but only the specified input columns.
     *
     * @param columns	names of the input columns to keep
     *
     * @return a reduced copy of this partition
     */
    public Partition selectInputs(List<String> columns) {
        return new Partition(this.learn.selectInputs(columns), this.validation.selectInputs(columns),
                this.test.selectInputs(columns), this.labels);
    }

    @Override
    public String toString() {
        return String.format("%d learning, %d validation, %d testing", this.learn.size(), this.validation.size(),
                this.test.size());
    }

}
