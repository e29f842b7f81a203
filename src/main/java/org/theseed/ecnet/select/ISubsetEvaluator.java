/**
 *
 */
package org.theseed.ecnet.select;

import java.util.List;

/**
 * This interface describes an object that scores a subset of input columns.  Typically it trains a model using
 * only those columns on the learning set and returns the RMSE on the validation set.  Lower is better.
 *
 * An evaluator used for parallel selection must be thread-safe.  An evaluation that is cut short (for example,
 * because the thread was interrupted) returns NaN, and the selector discards the round containing it.
 *
 * @author Bruce Parrello
 *
 */
public interface ISubsetEvaluator {

    /**
     * @return the error score for a model restricted to the specified input columns, or NaN if the evaluation
     * 		   did not finish
     *
     * @param columns	names of the input columns to use, in order
     */
    public double evaluate(List<String> columns);

}
