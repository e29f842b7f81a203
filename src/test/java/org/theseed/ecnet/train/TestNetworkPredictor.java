/**
 *
 */
package org.theseed.ecnet.train;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.theseed.ecnet.data.Dataset;
import org.theseed.ecnet.data.DatasetFixtures;
import org.theseed.ecnet.data.DatasetPartitioner;
import org.theseed.ecnet.metrics.ErrorMetrics;

/**
 * @author Bruce Parrello
 *
 */
public class TestNetworkPredictor {

    /**
     * Build an input matrix of random values between 0 and 1.
     *
     * @param rows		number of rows
     * @param cols		number of columns
     * @param rand		randomizer to use
     *
     * @return the input matrix
     */
    private static double[][] randomInputs(int rows, int cols, Random rand) {
        double[][] retVal = new double[rows][cols];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                retVal[r][c] = rand.nextDouble();
        return retVal;
    }

    @Test
    public void testLinearFit() {
        Random rand = new Random(100);
        double[][] inputs = randomInputs(60, 2, rand);
        double[][] outputs = new double[60][1];
        for (int r = 0; r < 60; r++)
            outputs[r][0] = 0.6 * inputs[r][0] - 0.3 * inputs[r][1] + 0.4;
        TrainingParameters parms = new TrainingParameters().setHiddenLayers("none").setLearningRate(0.05)
                .setBatchSize(20).setSeed(12345);
        NetworkPredictor predictor = new NetworkPredictor(2, 1, parms);
        double[][] before = predictor.predict(inputs);
        assertThat(before.length, equalTo(60));
        assertThat(before[0].length, equalTo(1));
        double startError = ErrorMetrics.rmse(before, outputs);
        for (int i = 0; i < 200; i++)
            predictor.trainOneEpoch(inputs, outputs);
        double endError = ErrorMetrics.rmse(predictor.predict(inputs), outputs);
        assertThat(endError, lessThan(startError));
        assertThat(endError, lessThan(0.1));
        // A network with the same seed starts out the same.
        NetworkPredictor other = new NetworkPredictor(2, 1, parms);
        double[][] otherBefore = other.predict(inputs);
        for (int r = 0; r < 60; r++)
            assertThat(otherBefore[r][0], closeTo(before[r][0], 1e-12));
        assertThat(predictor.getModel().getnLayers(), equalTo(1));
    }

    @Test
    public void testHiddenLayers() {
        TrainingParameters parms = new TrainingParameters().setHiddenLayers("6,3").setSeed(7);
        IPredictor predictor = new NetworkPredictor.Factory(parms).create(4, 2);
        assertThat(predictor, instanceOf(NetworkPredictor.class));
        assertThat(((NetworkPredictor) predictor).getModel().getnLayers(), equalTo(3));
        double[][] out = predictor.predict(randomInputs(5, 4, new Random(1)));
        assertThat(out.length, equalTo(5));
        assertThat(out[0].length, equalTo(2));
        for (double[] row : out) {
            for (double v : row)
                assertThat(Double.isFinite(v), equalTo(true));
        }
    }

    @Test
    public void testOrchestrated() {
        Dataset data = DatasetFixtures.linear(80, 2, 55);
        TrainingParameters parms = new TrainingParameters().setHiddenLayers("none").setLearningRate(0.05)
                .setBatchSize(16).setMemory(5).setStopThreshold(1e-4).setMaxEpochs(300);
        NetworkPredictor predictor = new NetworkPredictor(2, 1, parms);
        TrainingResult result = new TrainingOrchestrator(parms).run(data,
                new DatasetPartitioner.RandomPartitioner(parms.getSplitRatio(), parms.getSeed()), predictor);
        assertThat(result.isComplete(), equalTo(true));
        assertThat(result.getEpochCount(), lessThanOrEqualTo(300));
        assertThat(result.getBestError(), lessThan(result.getErrorSeries().get(0)));
        assertThat(result.getTestSummary().getCount(), equalTo(8));
    }

}
