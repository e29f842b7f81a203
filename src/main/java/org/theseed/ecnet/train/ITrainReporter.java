/**
 *
 */
package org.theseed.ecnet.train;

/**
 * This interface represents an object that can be used to report the progress of a training run.  A reporter
 * may abort the run between epochs by throwing InterruptedException; the trainer then returns the model as it
 * stands.
 *
 * @author Bruce Parrello
 *
 */
public interface ITrainReporter {

    /**
     * Display a general message showing a major status change.
     *
     * @param message	message to display
     */
    public void showMessage(String message);

    /**
     * Report the progress of the training.
     *
     * @param epoch		number of this epoch
     * @param error		validation error after this epoch
     * @param best		TRUE if this is the lowest error so far
     *
     * @throws InterruptedException
     */
    public void displayEpoch(int epoch, double error, boolean best) throws InterruptedException;

}
