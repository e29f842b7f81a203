/**
 *
 */
package org.theseed.ecnet.train;

import java.util.ArrayList;
import java.util.List;

/**
 * This object decides when an iterative training run should stop.  After each epoch the client passes in the
 * validation RMSE.  The controller keeps the last few values in a ring buffer and computes the mean absolute
 * epoch-to-epoch change over that window (the "mdrmse").  When the mdrmse drops below the stop threshold the
 * learning has plateaued and the run is converged.  If the epoch limit is reached first, the run stops
 * without converging.  The two outcomes are reported as different states.
 *
 * Until there are enough values to fill the window (memory + 1 of them), the run cannot converge.
 *
 * @author Bruce Parrello
 *
 */
public class ConvergenceController {

    /** state of a training run */
    public static enum State {
        /** training should continue */
        RUNNING,
        /** the validation error has plateaued */
        CONVERGED,
        /** the epoch limit was reached before convergence */
        MAX_EPOCHS_REACHED;

        /**
         * @return TRUE if this state ends the training loop
         */
        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    // FIELDS
    /** number of epoch-to-epoch changes to average */
    private final int memory;
    /** mean change below which the run is considered converged */
    private final double stopThreshold;
    /** maximum number of epochs */
    private final int maxEpochs;
    /** ring buffer of the most recent errors */
    private final double[] window;
    /** position in the ring buffer of the next error */
    private int windowPos;
    /** full error series, one per epoch */
    private final List<Double> series;
    /** current state */
    private State state;
    /** lowest error seen */
    private double bestError;
    /** epoch with the lowest error */
    private int bestEpoch;
    /** most recent mean change */
    private double mdrmse;

    /**
     * Construct a convergence controller.
     *
     * @param memory			number of recent epoch-to-epoch changes to average
     * @param stopThreshold		mean change below which the run is converged
     * @param maxEpochs			maximum number of epochs to allow
     */
    public ConvergenceController(int memory, double stopThreshold, int maxEpochs) {
        if (memory < 1)
            throw new IllegalArgumentException("Convergence memory must be at least 1.");
        if (! (stopThreshold >= 0.0))
            throw new IllegalArgumentException("Stop threshold must be nonnegative.");
        if (maxEpochs < 1)
            throw new IllegalArgumentException("Maximum epoch count must be at least 1.");
        this.memory = memory;
        this.stopThreshold = stopThreshold;
        this.maxEpochs = maxEpochs;
        this.window = new double[memory + 1];
        this.windowPos = 0;
        this.series = new ArrayList<Double>();
        this.state = State.RUNNING;
        this.bestError = Double.POSITIVE_INFINITY;
        this.bestEpoch = 0;
        this.mdrmse = Double.NaN;
    }

    /**
     * Record the validation error for the epoch just completed and compute the new state.
     *
     * @param error		validation RMSE after the epoch
     *
     * @return the new state
     *
     * @throws IllegalStateException if the run has already stopped
     * @throws IllegalArgumentException if the error is not a finite number
     */
    public State step(double error) {
        if (this.state.isTerminal())
            throw new IllegalStateException("Training run has already stopped (" + this.state + ").");
        if (! Double.isFinite(error))
            throw new IllegalArgumentException("Validation error must be finite, but was " + error + ".");
        this.series.add(error);
        this.window[this.windowPos] = error;
        this.windowPos = (this.windowPos + 1) % this.window.length;
        int epoch = this.series.size();
        if (error < this.bestError) {
            this.bestError = error;
            this.bestEpoch = epoch;
        }
        if (epoch > this.memory) {
            this.mdrmse = this.computeMeanChange();
            if (this.mdrmse < this.stopThreshold)
                this.state = State.CONVERGED;
        }
        if (this.state == State.RUNNING && epoch >= this.maxEpochs)
            this.state = State.MAX_EPOCHS_REACHED;
        return this.state;
    }

    /**
     * The window is full when this is called, so the oldest entry is at the current write position.
     *
     * @return the mean absolute change between consecutive errors in the window
     */
    private double computeMeanChange() {
        int n = this.window.length;
        double total = 0.0;
        double prev = this.window[this.windowPos];
        for (int i = 1; i < n; i++) {
            double curr = this.window[(this.windowPos + i) % n];
            total += Math.abs(curr - prev);
            prev = curr;
        }
        return total / this.memory;
    }

    /**
     * @return the current state
     */
    public State getState() {
        return this.state;
    }

    /**
     * @return TRUE if the training loop should stop
     */
    public boolean isStopped() {
        return this.state.isTerminal();
    }

    /**
     * @return the number of epochs recorded
     */
    public int getEpochCount() {
        return this.series.size();
    }

    /**
     * @return a copy of the error series, one value per epoch
     */
    public List<Double> getErrorSeries() {
        return new ArrayList<Double>(this.series);
    }

    /**
     * @return the most recent mean change, or NaN if there is not yet enough history
     */
    public double getMdrmse() {
        return this.mdrmse;
    }

    /**
     * @return the lowest error recorded
     */
    public double getBestError() {
        return this.bestError;
    }

    /**
     * @return the epoch (1-based) with the lowest error, or 0 if no epochs have been recorded
     */
    public int getBestEpoch() {
        return this.bestEpoch;
    }

    /**
     * @return the number of changes averaged
     */
    public int getMemory() {
        return this.memory;
    }

    /**
     * @return the convergence threshold
     */
    public double getStopThreshold() {
        return this.stopThreshold;
    }

    /**
     * @return the epoch limit
     */
    public int getMaxEpochs() {
        return this.maxEpochs;
    }

}
