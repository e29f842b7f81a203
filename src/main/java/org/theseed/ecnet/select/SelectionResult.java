/**
 *
 */
package org.theseed.ecnet.select;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object contains the result of a feature selection.  The retained columns are listed in the order they
 * were chosen, and for each one there is the error score of the subset that ended with it.  If the selection
 * was interrupted, the result is marked incomplete, but the columns chosen so far are still valid.
 *
 * @author Bruce Parrello
 *
 */
public class SelectionResult {

    // FIELDS
    /** retained columns, in order of selection */
    private final List<String> retained;
    /** winning error score for each round */
    private final List<Double> scores;
    /** TRUE if the selection reached its target */
    private boolean complete;

    /**
     * Construct an empty selection result.
     */
    public SelectionResult() {
        this.retained = new ArrayList<String>();
        this.scores = new ArrayList<Double>();
        this.complete = false;
    }

    /**
     * Record the winner of a selection round.
     *
     * @param column	name of the retained column
     * @param score		error score of the retained subset including the column
     */
    protected void add(String column, double score) {
        this.retained.add(column);
        this.scores.add(score);
    }

    /**
     * Denote that the selection reached its target.
     */
    protected void finish() {
        this.complete = true;
    }

    /**
     * @return the retained columns, in order of selection
     */
    public List<String> getRetained() {
        return Collections.unmodifiableList(this.retained);
    }

    /**
     * @return the winning error score for each round
     */
    public List<Double> getScores() {
        return Collections.unmodifiableList(this.scores);
    }

    /**
     * @return the error score of the final retained subset, or NaN if nothing was retained
     */
    public double getFinalScore() {
        return (this.scores.isEmpty() ? Double.NaN : this.scores.get(this.scores.size() - 1));
    }

    /**
     * @return TRUE if the selection reached its target, FALSE if it was interrupted
     */
    public boolean isComplete() {
        return this.complete;
    }

    @Override
    public String toString() {
        return this.retained.toString() + (this.complete ? "" : " (incomplete)");
    }

}
