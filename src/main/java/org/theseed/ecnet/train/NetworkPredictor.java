/**
 *
 */
package org.theseed.ecnet.train;

import java.util.List;

import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This predictor is a feed-forward network built with Deeplearning4j.  It has zero or more dense hidden layers
 * and a linear output layer trained against squared error.  The weight updates are performed by DL4J; this
 * class only builds the network and feeds it data.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkPredictor implements IPredictor {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NetworkPredictor.class);

    // FIELDS
    /** underlying network */
    private final MultiLayerNetwork model;
    /** mini-batch size */
    private final int batchSize;

    /**
     * Build a new network.
     *
     * @param nInputs		number of input columns
     * @param nOutputs		number of output columns
     * @param parms			tuning parameters describing the network
     */
    public NetworkPredictor(int nInputs, int nOutputs, TrainingParameters parms) {
        this.batchSize = Math.max(1, parms.getBatchSize());
        NeuralNetConfiguration.ListBuilder configuration = new NeuralNetConfiguration.Builder()
                .seed(parms.getSeed())
                .dataType(DataType.DOUBLE)
                .activation(parms.getActivation())
                .weightInit(WeightInit.XAVIER)
                .updater(parms.getUpdater().create(parms.getLearningRate()))
                .list();
        int width = nInputs;
        for (int layerSize : parms.getHiddenLayerWidths()) {
            log.debug("Creating hidden layer with input width {} and {} outputs.", width, layerSize);
            configuration.layer(new DenseLayer.Builder().nIn(width).nOut(layerSize).build());
            width = layerSize;
        }
        configuration.layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .activation(Activation.IDENTITY)
                .nIn(width).nOut(nOutputs).build());
        this.model = new MultiLayerNetwork(configuration.build());
        this.model.init();
    }

    @Override
    public void trainOneEpoch(double[][] inputs, double[][] outputs) {
        DataSet allData = new DataSet(Nd4j.create(inputs), Nd4j.create(outputs));
        List<DataSet> batches = allData.batchBy(this.batchSize);
        for (DataSet batch : batches)
            this.model.fit(batch);
    }

    @Override
    public double[][] predict(double[][] inputs) {
        INDArray output = this.model.output(Nd4j.create(inputs));
        return output.toDoubleMatrix();
    }

    /**
     * @return the underlying network
     */
    public MultiLayerNetwork getModel() {
        return this.model;
    }

    /**
     * This factory creates network predictors with a fixed set of tuning parameters.
     */
    public static class Factory implements IPredictor.Factory {

        /** tuning parameters for the networks */
        private final TrainingParameters parms;

        /**
         * Construct a network predictor factory.
         *
         * @param parms		tuning parameters for the networks
         */
        public Factory(TrainingParameters parms) {
            this.parms = parms;
        }

        @Override
        public IPredictor create(int nInputs, int nOutputs) {
            return new NetworkPredictor(nInputs, nOutputs, this.parms);
        }

    }

}
