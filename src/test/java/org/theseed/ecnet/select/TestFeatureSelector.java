/**
 *
 */
package org.theseed.ecnet.select;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.theseed.ecnet.EcnetException;

/**
 * @author Bruce Parrello
 *
 */
public class TestFeatureSelector {

    /** input columns for the tests */
    private static final List<String> COLUMNS = Arrays.asList("a", "b", "c", "d");

    /**
     * This evaluator gives each column a fixed gain.  The score of a subset is 10 minus the total gain, so
     * lower is better.  It counts the evaluations.
     */
    private static class AdditiveEvaluator implements ISubsetEvaluator {

        private final Map<String, Double> gains;
        private final AtomicInteger count;

        public AdditiveEvaluator(double... values) {
            this.gains = new HashMap<String, Double>();
            for (int i = 0; i < values.length; i++)
                this.gains.put(COLUMNS.get(i), values[i]);
            this.count = new AtomicInteger();
        }

        @Override
        public double evaluate(List<String> columns) {
            this.count.incrementAndGet();
            double retVal = 10.0;
            for (String column : columns)
                retVal -= this.gains.get(column);
            return retVal;
        }

        public int getCount() {
            return this.count.get();
        }

    }

    @Test
    public void testGreedy() {
        AdditiveEvaluator evaluator = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        FeatureSelector selector = new FeatureSelector(evaluator);
        SelectionResult result = selector.select(COLUMNS, 1);
        assertThat(result.getRetained(), contains("b"));
        assertThat(result.getFinalScore(), closeTo(7.0, 1e-12));
        assertThat(result.isComplete(), equalTo(true));
        assertThat(evaluator.getCount(), equalTo(4));
        evaluator = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        selector = new FeatureSelector(evaluator);
        result = selector.select(COLUMNS, 4);
        assertThat(result.getRetained(), contains("b", "c", "a", "d"));
        assertThat(result.getScores(), contains(closeTo(7.0, 1e-12), closeTo(5.0, 1e-12), closeTo(4.0, 1e-12),
                closeTo(4.0, 1e-12)));
        // Four rounds of 4, 3, 2, and 1 candidates.
        assertThat(evaluator.getCount(), equalTo(10));
        assertThat(result.toString(), not(containsString("incomplete")));
    }

    @Test
    public void testTies() {
        // Everything ties, so the canonical order wins.
        FeatureSelector selector = new FeatureSelector(new AdditiveEvaluator(1.0, 1.0, 1.0, 1.0));
        assertThat(selector.select(COLUMNS, 2).getRetained(), contains("a", "b"));
        selector = new FeatureSelector(new AdditiveEvaluator(0.0, 2.0, 2.0, 1.0));
        assertThat(selector.select(COLUMNS, 3).getRetained(), contains("b", "c", "d"));
        // Scores within the tolerance count as tied.
        assertThat(FeatureSelector.chooseBest(new double[] { 1.0, 1.0 - 1e-14, 2.0 }), equalTo(0));
        assertThat(FeatureSelector.chooseBest(new double[] { 1.0, 0.5, 0.5 }), equalTo(1));
        // NaN never wins unless everything is NaN.
        assertThat(FeatureSelector.chooseBest(new double[] { Double.NaN, 3.0, 2.0 }), equalTo(2));
        assertThat(FeatureSelector.chooseBest(new double[] { Double.NaN, Double.NaN }), equalTo(0));
    }

    @Test
    public void testInteraction() {
        // Columns b and c are only useful together, and d is a weak column on its own.
        ISubsetEvaluator evaluator = columns -> {
            double retVal = 10.0;
            if (columns.contains("d")) retVal -= 1.0;
            if (columns.contains("b") && columns.contains("c")) retVal -= 5.0;
            else if (columns.contains("b")) retVal -= 0.5;
            return retVal;
        };
        FeatureSelector selector = new FeatureSelector(evaluator);
        // The greedy method takes d first, then b, and then finds c.
        SelectionResult result = selector.select(COLUMNS, 3);
        assertThat(result.getRetained(), contains("d", "b", "c"));
        assertThat(result.getFinalScore(), closeTo(4.0, 1e-12));
    }

    @Test
    public void testParallel() {
        AdditiveEvaluator serial = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        AdditiveEvaluator parallel = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        SelectionResult result1 = new FeatureSelector(serial).select(COLUMNS, 3);
        SelectionResult result2 = new FeatureSelector(parallel).setParallel(true).select(COLUMNS, 3);
        assertThat(result2.getRetained(), equalTo(result1.getRetained()));
        assertThat(result2.getScores(), equalTo(result1.getScores()));
        assertThat(parallel.getCount(), equalTo(serial.getCount()));
        // Ties are still broken by canonical order.
        SelectionResult result3 = new FeatureSelector(new AdditiveEvaluator(2.0, 2.0, 2.0, 2.0)).setParallel(true)
                .select(COLUMNS, 4);
        assertThat(result3.getRetained(), contains("a", "b", "c", "d"));
    }

    @Test
    public void testErrors() {
        FeatureSelector selector = new FeatureSelector(new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0));
        EcnetException e = assertThrows(EcnetException.class, () -> selector.select(COLUMNS, 5));
        assertThat(e.getType(), equalTo(EcnetException.Type.INSUFFICIENT_FEATURES));
        assertThrows(IllegalArgumentException.class, () -> selector.select(COLUMNS, 0));
    }

    @Test
    public void testInterrupt() {
        AdditiveEvaluator base = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        // This evaluator interrupts the current thread during the first round.
        ISubsetEvaluator evaluator = columns -> {
            if (base.getCount() == 1)
                Thread.currentThread().interrupt();
            return base.evaluate(columns);
        };
        try {
            SelectionResult result = new FeatureSelector(evaluator).select(COLUMNS, 3);
            // The interrupted round is discarded, so nothing is retained.
            assertThat(result.isComplete(), equalTo(false));
            assertThat(result.getRetained(), empty());
            assertThat(result.getScores(), empty());
            assertThat(result.toString(), containsString("incomplete"));
            assertThat(base.getCount(), equalTo(4));
        } finally {
            assertThat(Thread.interrupted(), equalTo(true));
        }
    }

    @Test
    public void testUnfinishedRound() {
        AdditiveEvaluator base = new AdditiveEvaluator(1.0, 3.0, 2.0, 0.0);
        // This evaluator reports an unfinished trial for one candidate in the second round.
        ISubsetEvaluator evaluator = columns -> {
            double retVal = base.evaluate(columns);
            if (columns.size() == 2 && columns.get(1).equals("c"))
                retVal = Double.NaN;
            return retVal;
        };
        SelectionResult result = new FeatureSelector(evaluator).select(COLUMNS, 3);
        assertThat(result.isComplete(), equalTo(false));
        assertThat(result.getRetained(), contains("b"));
        assertThat(base.getCount(), equalTo(7));
        assertThat(Thread.currentThread().isInterrupted(), equalTo(false));
        // The parallel search discards the round the same way.
        result = new FeatureSelector(evaluator).setParallel(true).select(COLUMNS, 3);
        assertThat(result.isComplete(), equalTo(false));
        assertThat(result.getRetained(), contains("b"));
    }

}
