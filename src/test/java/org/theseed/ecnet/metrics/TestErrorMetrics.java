/**
 *
 */
package org.theseed.ecnet.metrics;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.theseed.ecnet.EcnetException;

/**
 * @author Bruce Parrello
 *
 */
public class TestErrorMetrics {

    @Test
    public void testRmse() {
        double[] actual = new double[] { 1.0, 2.0, 3.0 };
        assertThat(ErrorMetrics.rmse(new double[] { 1.0, 2.0, 3.0 }, actual), equalTo(0.0));
        assertThat(ErrorMetrics.rmse(new double[] { 2.0, 3.0, 4.0 }, actual), closeTo(1.0, 1e-12));
        assertThat(ErrorMetrics.rmse(new double[] { 1.0, 2.0, 6.0 }, actual), closeTo(Math.sqrt(3.0), 1e-12));
        double[][] predicted = new double[][] { { 1.0, 2.0 }, { 3.0, 4.0 } };
        double[][] expected = new double[][] { { 2.0, 2.0 }, { 3.0, 6.0 } };
        assertThat(ErrorMetrics.rmse(predicted, expected), closeTo(Math.sqrt(5.0 / 4.0), 1e-12));
    }

    @Test
    public void testAbsoluteErrors() {
        double[] actual = new double[] { 0.0, 0.0, 0.0, 0.0 };
        double[] predicted = new double[] { 1.0, -2.0, 4.0, -3.0 };
        assertThat(ErrorMetrics.meanAbsoluteError(predicted, actual), closeTo(2.5, 1e-12));
        // Even count, so the median is between 2 and 3.
        assertThat(ErrorMetrics.medianAbsoluteError(predicted, actual), closeTo(2.5, 1e-12));
        double[] odd = new double[] { 1.0, 10.0, 2.0 };
        assertThat(ErrorMetrics.medianAbsoluteError(odd, new double[3]), closeTo(2.0, 1e-12));
        assertThat(ErrorMetrics.meanAbsoluteError(new double[][] { { 1.0 }, { 3.0 } }, new double[][] { { 0.0 }, { 0.0 } }),
                closeTo(2.0, 1e-12));
    }

    @Test
    public void testRSquared() {
        double[] actual = new double[] { 1.0, 2.0, 3.0, 4.0 };
        assertThat(ErrorMetrics.rSquared(actual.clone(), actual), closeTo(1.0, 1e-12));
        // SS_tot = 5, SS_res = 1.
        double[] predicted = new double[] { 1.5, 2.5, 2.5, 3.5 };
        assertThat(ErrorMetrics.rSquared(predicted, actual), closeTo(0.8, 1e-12));
        // Constant actual values are fine if the prediction is exact.
        double[] flat = new double[] { 2.0, 2.0, 2.0 };
        assertThat(ErrorMetrics.isRSquaredDefined(flat.clone(), flat), equalTo(true));
        assertThat(ErrorMetrics.rSquared(flat.clone(), flat), equalTo(1.0));
        double[] miss = new double[] { 2.0, 2.5, 2.0 };
        assertThat(ErrorMetrics.isRSquaredDefined(miss, flat), equalTo(false));
        EcnetException e = assertThrows(EcnetException.class, () -> ErrorMetrics.rSquared(miss, flat));
        assertThat(e.getType(), equalTo(EcnetException.Type.UNDEFINED_METRIC));
    }

    @Test
    public void testBadInputs() {
        EcnetException e = assertThrows(EcnetException.class,
                () -> ErrorMetrics.rmse(new double[] { 1.0, 2.0 }, new double[] { 1.0 }));
        assertThat(e.getType(), equalTo(EcnetException.Type.DIMENSION_MISMATCH));
        e = assertThrows(EcnetException.class, () -> ErrorMetrics.meanAbsoluteError(new double[0], new double[0]));
        assertThat(e.getType(), equalTo(EcnetException.Type.EMPTY_INPUT));
        e = assertThrows(EcnetException.class, () -> ErrorMetrics.medianAbsoluteError(new double[0], new double[0]));
        assertThat(e.getType(), equalTo(EcnetException.Type.EMPTY_INPUT));
        e = assertThrows(EcnetException.class, () -> ErrorMetrics.rSquared(new double[0], new double[0]));
        assertThat(e.getType(), equalTo(EcnetException.Type.EMPTY_INPUT));
        e = assertThrows(EcnetException.class,
                () -> ErrorMetrics.rmse(new double[][] { { 1.0, 2.0 } }, new double[][] { { 1.0 } }));
        assertThat(e.getType(), equalTo(EcnetException.Type.DIMENSION_MISMATCH));
        e = assertThrows(EcnetException.class,
                () -> ErrorMetrics.rmse(new double[][] { { 1.0 } }, new double[][] { { 1.0 }, { 2.0 } }));
        assertThat(e.getType(), equalTo(EcnetException.Type.DIMENSION_MISMATCH));
    }

    @Test
    public void testSummary() {
        double[][] actual = new double[][] { { 1.0 }, { 2.0 }, { 3.0 }, { 4.0 } };
        double[][] predicted = new double[][] { { 1.5 }, { 2.5 }, { 2.5 }, { 3.5 } };
        ErrorSummary summary = new ErrorSummary(predicted, actual);
        assertThat(summary.getCount(), equalTo(4));
        assertThat(summary.getRmse(), closeTo(0.5, 1e-12));
        assertThat(summary.getMeanAbsError(), closeTo(0.5, 1e-12));
        assertThat(summary.getMedianAbsError(), closeTo(0.5, 1e-12));
        assertThat(summary.isRSquaredDefined(), equalTo(true));
        assertThat(summary.getRSquared(), closeTo(0.8, 1e-12));
        assertThat(summary.toString(), containsString("R-squared"));
        // A constant actual column does not break the summary.
        double[][] flat = new double[][] { { 2.0 }, { 2.0 } };
        summary = new ErrorSummary(new double[][] { { 1.0 }, { 3.0 } }, flat);
        assertThat(summary.isRSquaredDefined(), equalTo(false));
        assertThat(Double.isNaN(summary.getRSquared()), equalTo(true));
        assertThat(summary.getRmse(), closeTo(1.0, 1e-12));
        assertThat(summary.toString(), containsString("undefined"));
    }

}
