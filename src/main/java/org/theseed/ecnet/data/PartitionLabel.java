/**
 *
 */
package org.theseed.ecnet.data;

import org.apache.commons.lang3.StringUtils;
import org.theseed.ecnet.EcnetException;

/**
 * This enumeration describes the subset to which a sample is assigned.  Each label has a single-letter code
 * used in database files.
 *
 * @author Bruce Parrello
 *
 */
public enum PartitionLabel {
    /** used to fit the model parameters */
    LEARN("L"),
    /** used for convergence and selection decisions */
    VALIDATION("V"),
    /** held out for the final evaluation */
    TEST("T");

    // FIELDS
    /** single-letter code */
    private final String code;

    private PartitionLabel(String code) {
        this.code = code;
    }

    /**
     * @return the single-letter code for this label
     */
    public String getCode() {
        return this.code;
    }

    /**
     * Convert a string to a partition label.  Both the single-letter code and the full name are accepted,
     * in any case.
     *
     * @param string	string to parse
     *
     * @return the corresponding partition label
     *
     * @throws EcnetException if the string is not a recognized label
     */
    public static PartitionLabel parse(String string) {
        PartitionLabel retVal = null;
        String value = StringUtils.trimToEmpty(string);
        for (PartitionLabel label : PartitionLabel.values()) {
            if (label.code.equalsIgnoreCase(value) || label.name().equalsIgnoreCase(value))
                retVal = label;
        }
        if (retVal == null)
            throw new EcnetException(EcnetException.Type.INVALID_LABEL, "Invalid partition label \"" + string + "\".");
        return retVal;
    }

}
