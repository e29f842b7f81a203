/**
 *
 */
package org.theseed.ecnet.reports;

import org.theseed.ecnet.train.ITrainReporter;

/**
 * This is a no-op for training reporting.  It is used as the default when no listening is needed.
 *
 * @author Bruce Parrello
 *
 */
public class NullTrainReporter implements ITrainReporter {

    @Override
    public void showMessage(String message) {
    }

    @Override
    public void displayEpoch(int epoch, double error, boolean best) {
    }

}
