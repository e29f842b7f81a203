/**
 *
 */
package org.theseed.ecnet.data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This object contains the minimum and maximum value for each normalized column.  It is computed once,
 * usually from the learning set, and then applied unchanged to any other data.  It is serializable so that
 * a client can store it next to a trained model.
 *
 * @author Bruce Parrello
 *
 */
public class NormalizationParameters implements Serializable {

    /** serialization version ID */
    private static final long serialVersionUID = -3710469216367251130L;

    /**
     * This object describes the value range of a single column.
     */
    public static class Range implements Serializable {

        /** serialization version ID */
        private static final long serialVersionUID = 4476920132617048412L;
        /** minimum value */
        private final double min;
        /** maximum value */
        private final double max;

        /**
         * Construct a range.
         *
         * @param min	minimum column value
         * @param max	maximum column value
         */
        public Range(double min, double max) {
            if (! (max >= min))
                throw new IllegalArgumentException("Range maximum " + max + " is less than minimum " + min + ".");
            this.min = min;
            this.max = max;
        }

        /**
         * @return the minimum value
         */
        public double getMin() {
            return this.min;
        }

        /**
         * @return the maximum value
         */
        public double getMax() {
            return this.max;
        }

        /**
         * @return TRUE if the column is constant
         */
        public boolean isDegenerate() {
            return this.max == this.min;
        }

        @Override
        public String toString() {
            return "[" + this.min + ", " + this.max + "]";
        }

    }

    // FIELDS
    /** map of column names to ranges, in column order */
    private final LinkedHashMap<String, Range> ranges;

    /**
     * Construct an empty parameter set.
     */
    public NormalizationParameters() {
        this.ranges = new LinkedHashMap<String, Range>();
    }

    /**
     * Store the range for a column.
     *
     * @param column	name of the column
     * @param min		minimum value
     * @param max		maximum value
     */
    public void put(String column, double min, double max) {
        this.ranges.put(column, new Range(min, max));
    }

    /**
     * @return the range for the named column, or NULL if it is not normalized
     *
     * @param column	name of the column
     */
    public Range get(String column) {
        return this.ranges.get(column);
    }

    /**
     * @return the range for the named column
     *
     * @param column	name of the column
     *
     * @throws IllegalArgumentException if the column is not normalized
     */
    public Range require(String column) {
        Range retVal = this.ranges.get(column);
        if (retVal == null)
            throw new IllegalArgumentException("No normalization parameters for column \"" + column + "\".");
        return retVal;
    }

    /**
     * @return TRUE if the named column is normalized
     *
     * @param column	name of the column
     */
    public boolean contains(String column) {
        return this.ranges.containsKey(column);
    }

    /**
     * @return the names of the normalized columns, in the order they were added
     */
    public List<String> getColumns() {
        return new ArrayList<String>(this.ranges.keySet());
    }

    /**
     * @return an unmodifiable view of the column ranges
     */
    public Map<String, Range> asMap() {
        return Collections.unmodifiableMap(this.ranges);
    }

    @Override
    public String toString() {
        return this.ranges.toString();
    }

}
