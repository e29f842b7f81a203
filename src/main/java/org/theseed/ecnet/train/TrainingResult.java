/**
 *
 */
package org.theseed.ecnet.train;

import java.util.List;

import org.apache.commons.text.TextStringBuilder;
import org.theseed.ecnet.data.NormalizationParameters;
import org.theseed.ecnet.data.Partition;
import org.theseed.ecnet.metrics.ErrorSummary;

/**
 * This object describes the outcome of a training run.  It contains the trained predictor, the validation
 * error series, and the reason the run stopped.  A run interrupted between epochs is marked incomplete; its
 * predictor is still usable, but the run did not reach a stopping state.
 *
 * @author Bruce Parrello
 *
 */
public class TrainingResult {

    // FIELDS
    /** trained predictor */
    private final IPredictor predictor;
    /** final controller state */
    private final ConvergenceController.State state;
    /** validation error for each epoch */
    private final List<Double> errorSeries;
    /** epoch with the lowest validation error */
    private final int bestEpoch;
    /** lowest validation error */
    private final double bestError;
    /** TRUE if the run reached a stopping state */
    private final boolean complete;
    /** displayable duration of the run */
    private final String duration;
    /** normalization parameters used, or NULL if the data was prepared by the caller */
    private NormalizationParameters normalization;
    /** partition of the normalized data */
    private Partition partition;
    /** error summary for the testing set, or NULL if there was none */
    private ErrorSummary testSummary;

    /**
     * Construct a training result.
     *
     * @param predictor		trained predictor
     * @param controller	convergence controller that ran the training
     * @param complete		TRUE if the run reached a stopping state
     * @param duration		displayable duration of the run
     */
    public TrainingResult(IPredictor predictor, ConvergenceController controller, boolean complete, String duration) {
        this.predictor = predictor;
        this.state = controller.getState();
        this.errorSeries = controller.getErrorSeries();
        this.bestEpoch = controller.getBestEpoch();
        this.bestError = controller.getBestError();
        this.complete = complete;
        this.duration = duration;
        this.normalization = null;
        this.partition = null;
        this.testSummary = null;
    }

    /**
     * @return the trained predictor
     */
    public IPredictor getPredictor() {
        return this.predictor;
    }

    /**
     * @return the state in which the run stopped
     */
    public ConvergenceController.State getState() {
        return this.state;
    }

    /**
     * @return TRUE if the run stopped because the validation error plateaued
     */
    public boolean isConverged() {
        return this.state == ConvergenceController.State.CONVERGED;
    }

    /**
     * @return the validation error for each epoch
     */
    public List<Double> getErrorSeries() {
        return this.errorSeries;
    }

    /**
     * @return the number of epochs run
     */
    public int getEpochCount() {
        return this.errorSeries.size();
    }

    /**
     * @return the epoch with the lowest validation error
     */
    public int getBestEpoch() {
        return this.bestEpoch;
    }

    /**
     * @return the lowest validation error
     */
    public double getBestError() {
        return this.bestError;
    }

    /**
     * @return the validation error after the last epoch, or NaN if no epochs ran
     */
    public double getFinalError() {
        return (this.errorSeries.isEmpty() ? Double.NaN : this.errorSeries.get(this.errorSeries.size() - 1));
    }

    /**
     * @return TRUE if the run reached a stopping state, FALSE if it was interrupted
     */
    public boolean isComplete() {
        return this.complete;
    }

    /**
     * @return the displayable duration of the run
     */
    public String getDuration() {
        return this.duration;
    }

    /**
     * @return the normalization parameters, or NULL if the caller prepared the data
     */
    public NormalizationParameters getNormalization() {
        return this.normalization;
    }

    /**
     * Store the normalization parameters.
     *
     * @param normalization		parameters used to normalize the data
     */
    protected void setNormalization(NormalizationParameters normalization) {
        this.normalization = normalization;
    }

    /**
     * @return the partition of the normalized data, or NULL if the caller prepared the data
     */
    public Partition getPartition() {
        return this.partition;
    }

    /**
     * Store the data partition.
     *
     * @param partition		partition of the normalized data
     */
    protected void setPartition(Partition partition) {
        this.partition = partition;
    }

    /**
     * @return the error summary for the testing set (in original units), or NULL if there was no testing set
     */
    public ErrorSummary getTestSummary() {
        return this.testSummary;
    }

    /**
     * Store the testing set error summary.
     *
     * @param testSummary	error summary for the testing set
     */
    protected void setTestSummary(ErrorSummary testSummary) {
        this.testSummary = testSummary;
    }

    @Override
    public String toString() {
        TextStringBuilder retVal = new TextStringBuilder();
        retVal.appendln("Training %s after %d epochs (%s) in %s.", (this.complete ? "stopped" : "was interrupted"),
                this.getEpochCount(), this.state, this.duration);
        retVal.appendln("Best validation error %g at epoch %d; final error %g.", this.bestError, this.bestEpoch,
                this.getFinalError());
        if (this.testSummary != null) {
            retVal.appendln("Testing set results:");
            retVal.append(this.testSummary.toString());
        }
        return retVal.toString();
    }

}
