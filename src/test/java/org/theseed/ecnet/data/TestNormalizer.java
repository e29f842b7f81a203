/**
 *
 */
package org.theseed.ecnet.data;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.ecnet.EcnetException;

/**
 * @author Bruce Parrello
 *
 */
public class TestNormalizer {

    @Test
    public void testRoundTrip() {
        Dataset data = DatasetFixtures.linear(30, 3, 1234);
        NormalizationParameters params = Normalizer.computeParameters(data);
        assertThat(params.getColumns(), contains("x1", "x2", "x3", "y"));
        Dataset normal = Normalizer.normalize(data, params);
        assertThat(normal.size(), equalTo(data.size()));
        for (String col : params.getColumns()) {
            double[] raw = data.getColumn(col);
            double[] scaled = normal.getColumn(col);
            double min = Arrays.stream(scaled).min().getAsDouble();
            double max = Arrays.stream(scaled).max().getAsDouble();
            assertThat(col, min, closeTo(0.0, 1e-12));
            assertThat(col, max, closeTo(1.0, 1e-12));
            for (int i = 0; i < raw.length; i++) {
                assertThat(col, Normalizer.denormalize(scaled[i], params, col), closeTo(raw[i], 1e-9));
                assertThat(col, Normalizer.normalize(raw[i], params, col), closeTo(scaled[i], 1e-12));
            }
        }
        // The original dataset is untouched.
        assertThat(data.getRow(0).getInput(0), equalTo(DatasetFixtures.linear(30, 3, 1234).getRow(0).getInput(0)));
        // Matrix denormalization of outputs.
        double[][] back = Normalizer.denormalize(normal.getOutputMatrix(), params, normal.getOutputNames());
        double[][] orig = data.getOutputMatrix();
        for (int i = 0; i < back.length; i++)
            assertThat(back[i][0], closeTo(orig[i][0], 1e-9));
    }

    @Test
    public void testOutOfRange() {
        NormalizationParameters params = new NormalizationParameters();
        params.put("a", 10.0, 20.0);
        // New data outside the fitted range is not clamped, so it still inverts exactly.
        double v = Normalizer.normalize(25.0, params, "a");
        assertThat(v, closeTo(1.5, 1e-12));
        assertThat(Normalizer.denormalize(v, params, "a"), closeTo(25.0, 1e-12));
        assertThat(Normalizer.normalize(5.0, params, "a"), closeTo(-0.5, 1e-12));
    }

    @Test
    public void testDegenerate() {
        List<DataRow> rows = Arrays.asList(new DataRow("a", new double[] { 4.0, 1.0 }, new double[] { 0.0 }),
                new DataRow("b", new double[] { 4.0, 2.0 }, new double[] { 1.0 }),
                new DataRow("c", new double[] { 4.0, 3.0 }, new double[] { 2.0 }));
        Dataset data = new Dataset(Arrays.asList("flat", "slope"), Arrays.asList("out"), rows);
        NormalizationParameters params = Normalizer.computeParameters(data);
        assertThat(params.get("flat").isDegenerate(), equalTo(true));
        assertThat(params.get("slope").isDegenerate(), equalTo(false));
        Dataset normal = Normalizer.normalize(data, params);
        for (double v : normal.getColumn("flat"))
            assertThat(v, equalTo(0.5));
        assertThat(normal.getColumn("slope"), equalTo(new double[] { 0.0, 0.5, 1.0 }));
        // A different value in a constant column still normalizes to the fallback.
        assertThat(Normalizer.normalize(7.0, params, "flat"), equalTo(0.5));
        assertThat(Normalizer.denormalize(0.5, params, "flat"), equalTo(4.0));
    }

    @Test
    public void testPartialColumns() {
        Dataset data = DatasetFixtures.linear(10, 2, 99);
        NormalizationParameters params = Normalizer.computeParameters(data, Arrays.asList("x2"));
        assertThat(params.contains("x1"), equalTo(false));
        Dataset normal = Normalizer.normalize(data, params);
        assertThat(normal.getColumn("x1"), equalTo(data.getColumn("x1")));
        assertThat(normal.getColumn("y"), equalTo(data.getColumn("y")));
        assertThat(normal.getColumn("x2"), not(equalTo(data.getColumn("x2"))));
        assertThrows(IllegalArgumentException.class, () -> Normalizer.denormalize(0.5, params, "x1"));
    }

    @Test
    public void testEmpty() {
        Dataset data = new Dataset(Arrays.asList("x"), Arrays.asList("y"), Collections.emptyList());
        EcnetException e = assertThrows(EcnetException.class, () -> Normalizer.computeParameters(data));
        assertThat(e.getType(), equalTo(EcnetException.Type.EMPTY_INPUT));
    }

}
