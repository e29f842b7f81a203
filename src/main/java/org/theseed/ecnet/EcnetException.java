/**
 *
 */
package org.theseed.ecnet;

/**
 * This exception is thrown when a caller asks for something the data cannot support:  mismatched or
 * empty metric inputs, an undefined coefficient of determination, a bad split ratio, an unrecognized
 * partition label, or more retained features than there are columns.  None of these can be fixed by
 * retrying, so the type is exposed for the caller to act on.
 *
 * @author Bruce Parrello
 *
 */
public class EcnetException extends RuntimeException {

    /** serialization version ID */
    private static final long serialVersionUID = 6235880924418372914L;

    /** type of failure */
    public static enum Type {
        /** sequences of different lengths passed to a metric */
        DIMENSION_MISMATCH,
        /** metric or normalization computed over zero values */
        EMPTY_INPUT,
        /** R-squared on constant actual values with a nonzero residual */
        UNDEFINED_METRIC,
        /** split fractions out of range or not summing to 1 */
        INVALID_SPLIT_RATIO,
        /** explicit partition label not recognized */
        INVALID_LABEL,
        /** more retained features requested than are available */
        INSUFFICIENT_FEATURES;
    }

    // FIELDS
    /** type of this failure */
    private final Type type;

    /**
     * Construct a new exception.
     *
     * @param type		type of failure
     * @param message	descriptive message
     */
    public EcnetException(Type type, String message) {
        super(message);
        this.type = type;
    }

    /**
     * @return the type of failure
     */
    public Type getType() {
        return this.type;
    }

}
