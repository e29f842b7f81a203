/**
 *
 */
package org.theseed.ecnet.data;

import org.theseed.ecnet.EcnetException;

/**
 * This object describes the fractions of a dataset to assign to the learn, validation, and test subsets.
 * Each fraction must be between 0 and 1, and together they must sum to 1.
 *
 * @author Bruce Parrello
 *
 */
public class SplitRatio {

    // FIELDS
    /** tolerance for the sum of the fractions */
    public static final double TOLERANCE = 1e-6;
    /** default split */
    public static final SplitRatio DEFAULT = new SplitRatio(0.7, 0.2, 0.1);
    /** fraction of samples for learning */
    private final double learn;
    /** fraction of samples for validation */
    private final double validation;
    /** fraction of samples for testing */
    private final double test;

    /**
     * Construct a split ratio.
     *
     * @param learn			fraction of samples for learning
     * @param validation	fraction of samples for validation
     * @param test			fraction of samples for testing
     *
     * @throws EcnetException if a fraction is out of range or the fractions do not sum to 1
     */
    public SplitRatio(double learn, double validation, double test) {
        checkFraction("learn", learn);
        checkFraction("validation", validation);
        checkFraction("test", test);
        double total = learn + validation + test;
        if (Math.abs(total - 1.0) > TOLERANCE)
            throw new EcnetException(EcnetException.Type.INVALID_SPLIT_RATIO,
                    String.format("Split fractions %g, %g, %g sum to %g instead of 1.", learn, validation, test, total));
        this.learn = learn;
        this.validation = validation;
        this.test = test;
    }

    /**
     * Insure a fraction is in range.
     *
     * @param name		name of the fraction, for the error message
     * @param value		value to check
     */
    private static void checkFraction(String name, double value) {
        if (! (value >= 0.0 && value <= 1.0))
            throw new EcnetException(EcnetException.Type.INVALID_SPLIT_RATIO,
                    String.format("The %s fraction %g is not between 0 and 1.", name, value));
    }

    /**
     * @return the fraction of samples for learning
     */
    public double getLearn() {
        return this.learn;
    }

    /**
     * @return the fraction of samples for validation
     */
    public double getValidation() {
        return this.validation;
    }

    /**
     * @return the fraction of samples for testing
     */
    public double getTest() {
        return this.test;
    }

    /**
     * @return the number of learning samples for a dataset of the specified size
     *
     * @param n		number of samples in the dataset
     */
    public int learnCount(int n) {
        return (int) Math.floor(n * this.learn + TOLERANCE);
    }

    /**
     * @return the number of validation samples for a dataset of the specified size
     *
     * @param n		number of samples in the dataset
     */
    public int validationCount(int n) {
        int retVal = (int) Math.floor(n * this.validation + TOLERANCE);
        // Never hand out more rows than remain after the learning set.
        return Math.min(retVal, n - this.learnCount(n));
    }

    @Override
    public String toString() {
        return String.format("learn %g, validation %g, test %g", this.learn, this.validation, this.test);
    }

}
