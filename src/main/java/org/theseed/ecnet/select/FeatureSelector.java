/**
 *
 */
package org.theseed.ecnet.select;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.EcnetException;

/**
 * This object performs greedy forward selection of input columns.  It starts with no retained columns.  In each
 * round it asks the evaluator to score the retained columns plus each remaining candidate, and the candidate
 * with the lowest score is retained.  Selection stops when the target number of columns is retained.
 *
 * If the thread is interrupted, or an evaluation reports that it did not finish, the current round is
 * discarded and the columns retained in earlier rounds are returned as an incomplete result.
 *
 * Ties are broken in favor of the candidate that comes first in the original column order.  The candidates in
 * a round are independent of each other, so they may be evaluated in parallel; the winner is not chosen until
 * every score in the round is in, so the result does not depend on the order in which the evaluations finish.
 *
 * This is a heuristic.  Each round commits to the best single addition and never reconsiders, so the final set
 * is not guaranteed to be the best subset of its size.
 *
 * @author Bruce Parrello
 *
 */
public class FeatureSelector {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FeatureSelector.class);

    /** tolerance for treating two scores as tied */
    public static final double TIE_TOLERANCE = 1e-12;

    // FIELDS
    /** evaluator for column subsets */
    private final ISubsetEvaluator evaluator;
    /** TRUE to evaluate the candidates in a round in parallel */
    private boolean parallel;

    /**
     * Construct a feature selector.
     *
     * @param evaluator		object used to score column subsets
     */
    public FeatureSelector(ISubsetEvaluator evaluator) {
        this.evaluator = evaluator;
        this.parallel = false;
    }

    /**
     * Specify whether the candidates in a round should be evaluated in parallel.
     *
     * @param parallel	TRUE for parallel evaluation
     */
    public FeatureSelector setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /**
     * Select the best columns.
     *
     * @param columns	names of all the input columns, in their canonical order
     * @param k			number of columns to retain
     *
     * @return the retained columns, in the order they were chosen
     *
     * @throws EcnetException if there are fewer than k columns
     */
    public SelectionResult select(List<String> columns, int k) {
        if (k < 1)
            throw new IllegalArgumentException("Number of columns to retain must be at least 1.");
        if (k > columns.size())
            throw new EcnetException(EcnetException.Type.INSUFFICIENT_FEATURES,
                    String.format("Cannot retain %d columns from only %d.", k, columns.size()));
        SelectionResult retVal = new SelectionResult();
        List<String> retained = new ArrayList<String>(k);
        // The candidate list stays in canonical order, which is what the tie-break relies on.
        List<String> candidates = new ArrayList<String>(columns);
        boolean interrupted = false;
        while (retained.size() < k && ! candidates.isEmpty() && ! interrupted) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Feature selection interrupted after {} of {} columns.", retained.size(), k);
                interrupted = true;
            } else {
                double[] scores = this.scoreRound(retained, candidates);
                if (Thread.currentThread().isInterrupted() || Arrays.stream(scores).anyMatch(Double::isNaN)) {
                    // A trial in this round did not finish, so none of its scores can be compared.
                    log.warn("Feature selection round {} was interrupted and has been discarded.", retained.size() + 1);
                    interrupted = true;
                } else {
                    int winner = chooseBest(scores);
                    String column = candidates.remove(winner);
                    retained.add(column);
                    retVal.add(column, scores[winner]);
                    log.info("Round {}: retained \"{}\" with score {} ({} candidates evaluated).", retained.size(),
                            column, scores[winner], scores.length);
                }
            }
        }
        if (! interrupted)
            retVal.finish();
        return retVal;
    }

    /**
     * Score each candidate added to the retained columns.
     *
     * @param retained		columns already retained
     * @param candidates	columns still available
     *
     * @return an array of scores parallel to the candidate list
     */
    private double[] scoreRound(List<String> retained, List<String> candidates) {
        final int n = candidates.size();
        double[] retVal = new double[n];
        IntStream idxStream = IntStream.range(0, n);
        if (this.parallel)
            idxStream = idxStream.parallel();
        // Each task writes only its own slot, and the stream's terminal operation is the barrier.
        idxStream.forEach(i -> {
            List<String> trial = new ArrayList<String>(retained.size() + 1);
            trial.addAll(retained);
            trial.add(candidates.get(i));
            retVal[i] = this.evaluator.evaluate(trial);
            log.debug("Score for {} is {}.", trial, retVal[i]);
        });
        return retVal;
    }

    /**
     * Choose the best score.  A NaN score is never chosen unless every score is NaN.  When two scores are equal
     * within the tie tolerance, the earlier one wins.
     *
     * @param scores	array of scores, in canonical candidate order
     *
     * @return the index of the lowest score
     */
    public static int chooseBest(double[] scores) {
        int retVal = 0;
        double best = scores[0];
        for (int i = 1; i < scores.length; i++) {
            double score = scores[i];
            if (! Double.isNaN(score)) {
                if (Double.isNaN(best) || (score < best && ! Precision.equals(score, best, TIE_TOLERANCE))) {
                    best = score;
                    retVal = i;
                }
            }
        }
        return retVal;
    }

}
