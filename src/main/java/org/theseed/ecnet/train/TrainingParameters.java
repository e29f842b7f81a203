/**
 *
 */
package org.theseed.ecnet.train;

import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.TextStringBuilder;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.nd4j.linalg.activations.Activation;
import org.theseed.ecnet.data.SplitRatio;

/**
 * This object contains the tuning parameters for data preparation, feature selection, and training.  The
 * defaults are set by {@link #setDefaults()}.  The fields are annotated as options, so a client can fill them
 * in from an argument array with {@link #parse(String...)}.  The following options are supported.
 *
 * --memory		number of epoch-to-epoch changes averaged for the convergence test; the default is 10
 * --stop		mean change in validation error below which training is converged; the default is 1e-5
 * -e			maximum number of training epochs; the default is 1000
 * -s			random-number seed for partitioning and network initialization; the default is 42
 * --learn		fraction of the samples to use for learning; the default is 0.7
 * --valid		fraction of the samples to use for validation; the default is 0.2
 * --test		fraction of the samples to use for testing; the default is 0.1
 * -w			comma-delimited list of hidden layer widths; the default is "5,5"; use "none" for no
 * 				hidden layers
 * -a			activation function for hidden layers; the default is RELU
 * -r			learning rate; the default is 0.01
 * --updater	gradient updater; the default is ADAM
 * -b			mini-batch size for one epoch; the default is 32
 * -k			number of input columns to retain during feature selection; the default is 0, which
 * 				turns selection off
 * --parallel	if specified, candidate columns in a selection round are evaluated in parallel
 *
 * @author Bruce Parrello
 *
 */
public class TrainingParameters {

    // COMMAND-LINE OPTIONS

    /** number of epoch-to-epoch changes to average */
    @Option(name = "--memory", metaVar = "10", usage = "number of epochs in the convergence window")
    private int memory;
    /** convergence threshold */
    @Option(name = "--stop", metaVar = "1e-5", usage = "mean validation error change that indicates convergence")
    private double stopThreshold;
    /** maximum number of epochs */
    @Option(name = "-e", aliases = { "--maxEpochs" }, metaVar = "1000", usage = "maximum number of training epochs")
    private int maxEpochs;
    /** random-number seed */
    @Option(name = "-s", aliases = { "--seed" }, metaVar = "42", usage = "random-number seed")
    private long seed;
    /** learning fraction */
    @Option(name = "--learn", metaVar = "0.7", usage = "fraction of samples used for learning")
    private double learnFraction;
    /** validation fraction */
    @Option(name = "--valid", metaVar = "0.2", usage = "fraction of samples used for validation")
    private double validationFraction;
    /** testing fraction */
    @Option(name = "--test", metaVar = "0.1", usage = "fraction of samples used for testing")
    private double testFraction;
    /** hidden layer specification */
    @Option(name = "-w", aliases = { "--widths" }, metaVar = "10,5", usage = "comma-delimited hidden layer widths")
    private String hiddenLayers;
    /** hidden layer activation */
    @Option(name = "-a", aliases = { "--activation" }, usage = "activation function for hidden layers")
    private Activation activation;
    /** learning rate */
    @Option(name = "-r", aliases = { "--rate" }, metaVar = "0.01", usage = "learning rate")
    private double learningRate;
    /** gradient updater */
    @Option(name = "--updater", usage = "gradient updater algorithm")
    private UpdaterType updater;
    /** mini-batch size */
    @Option(name = "-b", aliases = { "--batchSize" }, metaVar = "32", usage = "mini-batch size within an epoch")
    private int batchSize;
    /** number of columns to retain in feature selection */
    @Option(name = "-k", aliases = { "--select" }, metaVar = "5", usage = "number of input columns to retain (0 for all)")
    private int targetCount;
    /** TRUE to evaluate selection candidates in parallel */
    @Option(name = "--parallel", usage = "evaluate feature selection candidates in parallel")
    private boolean parallel;

    /**
     * Construct a parameter object with default values.
     */
    public TrainingParameters() {
        this.setDefaults();
    }

    /**
     * Set the defaults for all the parameters.
     */
    public void setDefaults() {
        this.memory = 10;
        this.stopThreshold = 1e-5;
        this.maxEpochs = 1000;
        this.seed = 42;
        this.learnFraction = 0.7;
        this.validationFraction = 0.2;
        this.testFraction = 0.1;
        this.hiddenLayers = "5,5";
        this.activation = Activation.RELU;
        this.learningRate = 0.01;
        this.updater = UpdaterType.ADAM;
        this.batchSize = 32;
        this.targetCount = 0;
        this.parallel = false;
    }

    /**
     * Create a parameter object from an argument array.  Options not specified keep their defaults.
     *
     * @param args		option strings to parse
     *
     * @return the parameter object
     *
     * @throws CmdLineException if an option is invalid
     */
    public static TrainingParameters parse(String... args) throws CmdLineException {
        TrainingParameters retVal = new TrainingParameters();
        CmdLineParser parser = new CmdLineParser(retVal);
        parser.parseArgument(args);
        // Validate the hidden-layer string now so the error is reported as a parameter problem.
        try {
            retVal.getHiddenLayerWidths();
        } catch (NumberFormatException e) {
            throw new CmdLineException(parser, "Invalid hidden layer specification \"" + retVal.hiddenLayers + "\".", e);
        }
        return retVal;
    }

    /**
     * @return the split ratio for partitioning
     */
    public SplitRatio getSplitRatio() {
        return new SplitRatio(this.learnFraction, this.validationFraction, this.testFraction);
    }

    /**
     * @return a new convergence controller for a training run
     */
    public ConvergenceController createController() {
        return new ConvergenceController(this.memory, this.stopThreshold, this.maxEpochs);
    }

    /**
     * @return an array of the hidden layer widths
     */
    public int[] getHiddenLayerWidths() {
        int[] retVal;
        if (StringUtils.isBlank(this.hiddenLayers) || this.hiddenLayers.equalsIgnoreCase("none"))
            retVal = new int[0];
        else {
            String[] parts = StringUtils.split(this.hiddenLayers, ',');
            retVal = Arrays.stream(parts).mapToInt(x -> Integer.parseInt(x.trim())).toArray();
            for (int width : retVal) {
                if (width < 1)
                    throw new NumberFormatException("Layer width must be positive.");
            }
        }
        return retVal;
    }

    /**
     * @return the number of epoch-to-epoch changes averaged for the convergence test
     */
    public int getMemory() {
        return this.memory;
    }

    /**
     * Specify the number of epoch-to-epoch changes to average.
     *
     * @param memory	the number of changes to average
     */
    public TrainingParameters setMemory(int memory) {
        this.memory = memory;
        return this;
    }

    /**
     * @return the convergence threshold
     */
    public double getStopThreshold() {
        return this.stopThreshold;
    }

    /**
     * Specify the convergence threshold.
     *
     * @param stopThreshold		the mean change below which training is converged
     */
    public TrainingParameters setStopThreshold(double stopThreshold) {
        this.stopThreshold = stopThreshold;
        return this;
    }

    /**
     * @return the maximum number of epochs
     */
    public int getMaxEpochs() {
        return this.maxEpochs;
    }

    /**
     * Specify the maximum number of epochs.
     *
     * @param maxEpochs		the epoch limit to set
     */
    public TrainingParameters setMaxEpochs(int maxEpochs) {
        this.maxEpochs = maxEpochs;
        return this;
    }

    /**
     * @return the random-number seed
     */
    public long getSeed() {
        return this.seed;
    }

    /**
     * Specify the random-number seed.
     *
     * @param seed		the seed to set
     */
    public TrainingParameters setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * Specify the split fractions.
     *
     * @param learn			fraction of samples for learning
     * @param validation	fraction of samples for validation
     * @param test			fraction of samples for testing
     */
    public TrainingParameters setSplit(double learn, double validation, double test) {
        this.learnFraction = learn;
        this.validationFraction = validation;
        this.testFraction = test;
        return this;
    }

    /**
     * @return the hidden layer specification string
     */
    public String getHiddenLayers() {
        return this.hiddenLayers;
    }

    /**
     * Specify the hidden layers.
     *
     * @param hiddenLayers	comma-delimited list of layer widths, or "none"
     */
    public TrainingParameters setHiddenLayers(String hiddenLayers) {
        this.hiddenLayers = hiddenLayers;
        return this;
    }

    /**
     * @return the hidden layer activation function
     */
    public Activation getActivation() {
        return this.activation;
    }

    /**
     * Specify the hidden layer activation function.
     *
     * @param activation	the activation function to set
     */
    public TrainingParameters setActivation(Activation activation) {
        this.activation = activation;
        return this;
    }

    /**
     * @return the learning rate
     */
    public double getLearningRate() {
        return this.learningRate;
    }

    /**
     * Specify the learning rate.
     *
     * @param learningRate	the learning rate to set
     */
    public TrainingParameters setLearningRate(double learningRate) {
        this.learningRate = learningRate;
        return this;
    }

    /**
     * @return the gradient updater type
     */
    public UpdaterType getUpdater() {
        return this.updater;
    }

    /**
     * Specify the gradient updater type.
     *
     * @param updater	the updater type to set
     */
    public TrainingParameters setUpdater(UpdaterType updater) {
        this.updater = updater;
        return this;
    }

    /**
     * @return the mini-batch size
     */
    public int getBatchSize() {
        return this.batchSize;
    }

    /**
     * Specify the mini-batch size.
     *
     * @param batchSize		the batch size to set
     */
    public TrainingParameters setBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    /**
     * @return the number of input columns to retain in feature selection (0 for all)
     */
    public int getTargetCount() {
        return this.targetCount;
    }

    /**
     * Specify the number of input columns to retain in feature selection.
     *
     * @param targetCount	the number of columns to retain, or 0 for all
     */
    public TrainingParameters setTargetCount(int targetCount) {
        this.targetCount = targetCount;
        return this;
    }

    /**
     * @return TRUE if selection candidates are evaluated in parallel
     */
    public boolean isParallel() {
        return this.parallel;
    }

    /**
     * Specify whether selection candidates are evaluated in parallel.
     *
     * @param parallel	TRUE for parallel evaluation
     */
    public TrainingParameters setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    @Override
    public String toString() {
        TextStringBuilder retVal = new TextStringBuilder();
        retVal.appendln("Convergence window is %d epochs with threshold %g and a limit of %d epochs.",
                this.memory, this.stopThreshold, this.maxEpochs);
        retVal.appendln("Split is %g/%g/%g with seed %d.", this.learnFraction, this.validationFraction,
                this.testFraction, this.seed);
        retVal.appendln("Hidden layers %s with %s activation, %s updater at rate %g, batch size %d.",
                this.hiddenLayers, this.activation, this.updater, this.learningRate, this.batchSize);
        if (this.targetCount > 0)
            retVal.appendln("Feature selection retains %d columns%s.", this.targetCount,
                    (this.parallel ? " using parallel evaluation" : ""));
        return retVal.toString();
    }

}
