/**
 *
 */
package org.theseed.ecnet.reports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.train.ITrainReporter;

/**
 * This reporter writes training progress to the log.  To keep long runs readable, only every Nth epoch is
 * shown, along with every epoch that sets a new best error.
 *
 * @author Bruce Parrello
 *
 */
public class LogTrainReporter implements ITrainReporter {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(LogTrainReporter.class);

    // FIELDS
    /** epoch interval for progress messages */
    private final int interval;

    /**
     * Construct a reporter that logs every epoch.
     */
    public LogTrainReporter() {
        this(1);
    }

    /**
     * Construct a reporter that logs at a fixed epoch interval.
     *
     * @param interval	number of epochs between progress messages
     */
    public LogTrainReporter(int interval) {
        this.interval = Math.max(1, interval);
    }

    @Override
    public void showMessage(String message) {
        log.info(message);
    }

    @Override
    public void displayEpoch(int epoch, double error, boolean best) {
        if (best)
            log.info("Epoch {}: validation error {} (best so far).", epoch, error);
        else if (epoch % this.interval == 0)
            log.info("Epoch {}: validation error {}.", epoch, error);
    }

}
