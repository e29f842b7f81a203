/**
 *
 */
package org.theseed.ecnet.train;

/**
 * This interface describes a trainable numeric model.  The training code only needs to run one pass over the
 * learning data and to make predictions; how the model updates its parameters is its own business.  A
 * predictor must be deterministic:  the same internal state and the same inputs must give the same outputs.
 *
 * A predictor is owned by a single training run and must not be trained from two threads at once.
 *
 * @author Bruce Parrello
 *
 */
public interface IPredictor {

    /**
     * Train the model through one epoch of the learning data.
     *
     * @param inputs	input values, one row per sample
     * @param outputs	expected output values, one row per sample
     */
    public void trainOneEpoch(double[][] inputs, double[][] outputs);

    /**
     * @return the predicted outputs for a set of samples, one row per sample
     *
     * @param inputs	input values, one row per sample
     */
    public double[][] predict(double[][] inputs);

    /**
     * This interface describes an object that creates fresh, untrained predictors.  Feature selection needs a
     * new model for every column subset it tries.
     */
    public interface Factory {

        /**
         * @return a new predictor for the specified number of inputs and outputs
         *
         * @param nInputs		number of input columns
         * @param nOutputs		number of output columns
         */
        public IPredictor create(int nInputs, int nOutputs);

    }

}
