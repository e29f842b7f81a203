/**
 *
 */
package org.theseed.ecnet.train;

import org.apache.commons.lang3.time.DurationFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.EcnetException;
import org.theseed.ecnet.data.Dataset;
import org.theseed.ecnet.data.DatasetPartitioner;
import org.theseed.ecnet.data.NormalizationParameters;
import org.theseed.ecnet.data.Normalizer;
import org.theseed.ecnet.data.Partition;
import org.theseed.ecnet.data.PartitionLabel;
import org.theseed.ecnet.metrics.ErrorMetrics;
import org.theseed.ecnet.metrics.ErrorSummary;
import org.theseed.ecnet.reports.NullTrainReporter;

/**
 * This object runs a complete training cycle.  The dataset is labeled, the normalization parameters are
 * computed from the learning rows, and the normalized data is split into the three subsets.  The predictor is
 * then trained one epoch at a time, and after each epoch its validation error is passed to a convergence
 * controller, which decides when to stop.  Finally the predictor is scored against the testing set in the
 * original units.
 *
 * The dataset is never modified.  The predictor is modified on every epoch and belongs to the orchestrator for
 * the duration of the run.
 *
 * @author Bruce Parrello
 *
 */
public class TrainingOrchestrator {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TrainingOrchestrator.class);

    // FIELDS
    /** tuning parameters */
    private final TrainingParameters parms;
    /** progress reporter */
    private ITrainReporter monitor;

    /**
     * Construct a training orchestrator.
     *
     * @param parms		tuning parameters for the convergence controller
     */
    public TrainingOrchestrator(TrainingParameters parms) {
        this.parms = parms;
        this.monitor = new NullTrainReporter();
    }

    /**
     * Specify a progress reporter.
     *
     * @param monitor	reporter to receive epoch progress
     */
    public TrainingOrchestrator setReporter(ITrainReporter monitor) {
        this.monitor = monitor;
        return this;
    }

    /**
     * Prepare the data and train a predictor.
     *
     * @param dataset		raw dataset
     * @param partitioner	strategy for assigning rows to subsets
     * @param predictor		untrained predictor
     *
     * @return the results of the run
     */
    public TrainingResult run(Dataset dataset, DatasetPartitioner partitioner, IPredictor predictor) {
        PreparedData prepared = prepare(dataset, partitioner);
        Partition partition = prepared.getPartition();
        TrainingResult retVal = this.train(partition, predictor);
        retVal.setNormalization(prepared.getNormalization());
        retVal.setPartition(partition);
        Dataset testSet = partition.getTest();
        if (testSet.isEmpty())
            log.info("No testing set, so no test evaluation was performed.");
        else {
            double[][] predicted = Normalizer.denormalize(predictor.predict(testSet.getInputMatrix()),
                    prepared.getNormalization(), testSet.getOutputNames());
            double[][] actual = Normalizer.denormalize(testSet.getOutputMatrix(), prepared.getNormalization(),
                    testSet.getOutputNames());
            ErrorSummary summary = new ErrorSummary(predicted, actual);
            retVal.setTestSummary(summary);
            log.info("Testing set RMSE is {}.", summary.getRmse());
        }
        return retVal;
    }

    /**
     * Label a dataset, fit the normalization parameters to the learning rows, and split the normalized data.
     *
     * @param dataset		raw dataset
     * @param partitioner	strategy for assigning rows to subsets
     *
     * @return the normalization parameters and the normalized partition
     */
    public static PreparedData prepare(Dataset dataset, DatasetPartitioner partitioner) {
        PartitionLabel[] labels = partitioner.computeLabels(dataset);
        // Only the learning rows contribute to the normalization, so nothing leaks from the other subsets.
        Dataset rawLearn = DatasetPartitioner.apply(dataset, labels).getLearn();
        NormalizationParameters normalization = Normalizer.computeParameters(rawLearn);
        Dataset normalized = Normalizer.normalize(dataset, normalization);
        Partition partition = DatasetPartitioner.apply(normalized, labels);
        return new PreparedData(normalization, partition);
    }

    /**
     * Train a predictor on data that has already been prepared.
     *
     * @param partition		partition of the normalized dataset
     * @param predictor		predictor to train
     *
     * @return the results of the run
     *
     * @throws EcnetException if the learning or validation set is empty
     * @throws IllegalStateException if the predictor produces a non-finite validation error
     */
    public TrainingResult train(Partition partition, IPredictor predictor) {
        Dataset learn = partition.getLearn();
        Dataset validation = partition.getValidation();
        if (learn.isEmpty())
            throw new EcnetException(EcnetException.Type.EMPTY_INPUT, "Cannot train with an empty learning set.");
        if (validation.isEmpty())
            throw new EcnetException(EcnetException.Type.EMPTY_INPUT, "Cannot train with an empty validation set.");
        double[][] learnInputs = learn.getInputMatrix();
        double[][] learnOutputs = learn.getOutputMatrix();
        double[][] validInputs = validation.getInputMatrix();
        double[][] validOutputs = validation.getOutputMatrix();
        ConvergenceController controller = this.parms.createController();
        boolean complete = true;
        long start = System.currentTimeMillis();
        log.debug("Training with {} inputs on {}.", learn.getInputNames().size(), partition);
        try {
            while (! controller.isStopped()) {
                if (Thread.currentThread().isInterrupted())
                    throw new InterruptedException("Training thread interrupted.");
                predictor.trainOneEpoch(learnInputs, learnOutputs);
                double error = ErrorMetrics.rmse(predictor.predict(validInputs), validOutputs);
                int epoch = controller.getEpochCount() + 1;
                if (! Double.isFinite(error))
                    throw new IllegalStateException("Overflow/underflow in validation error at epoch " + epoch + ".");
                controller.step(error);
                this.monitor.displayEpoch(epoch, error, controller.getBestEpoch() == epoch);
            }
        } catch (InterruptedException e) {
            // Keep the interrupt visible to the caller and return the model as it stands.
            Thread.currentThread().interrupt();
            log.warn("Training interrupted after {} epochs.", controller.getEpochCount());
            complete = false;
        }
        String duration = DurationFormatUtils.formatDuration(System.currentTimeMillis() - start, "mm:ss");
        if (complete)
            this.monitor.showMessage(String.format("Training stopped (%s) after %d epochs in %s.  Best error %g at epoch %d.",
                    controller.getState(), controller.getEpochCount(), duration, controller.getBestError(),
                    controller.getBestEpoch()));
        return new TrainingResult(predictor, controller, complete, duration);
    }

    /**
     * This object holds a normalized partition along with the parameters that normalized it.
     */
    public static class PreparedData {

        /** normalization parameters fitted to the learning rows */
        private final NormalizationParameters normalization;
        /** partition of the normalized data */
        private final Partition partition;

        /**
         * Construct the prepared data.
         *
         * @param normalization		normalization parameters
         * @param partition			partition of the normalized data
         */
        public PreparedData(NormalizationParameters normalization, Partition partition) {
            this.normalization = normalization;
            this.partition = partition;
        }

        /**
         * @return the normalization parameters
         */
        public NormalizationParameters getNormalization() {
            return this.normalization;
        }

        /**
         * @return the normalized partition
         */
        public Partition getPartition() {
            return this.partition;
        }

    }

}
