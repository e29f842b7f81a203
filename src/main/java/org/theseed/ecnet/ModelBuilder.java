/**
 *
 */
package org.theseed.ecnet;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.data.Dataset;
import org.theseed.ecnet.data.DatasetPartitioner;
import org.theseed.ecnet.data.Partition;
import org.theseed.ecnet.reports.NullTrainReporter;
import org.theseed.ecnet.select.FeatureSelector;
import org.theseed.ecnet.select.SelectionResult;
import org.theseed.ecnet.select.TrainingSubsetEvaluator;
import org.theseed.ecnet.train.IPredictor;
import org.theseed.ecnet.train.ITrainReporter;
import org.theseed.ecnet.train.TrainingOrchestrator;
import org.theseed.ecnet.train.TrainingParameters;
import org.theseed.ecnet.train.TrainingResult;

/**
 * This object runs the whole model-building process.  The dataset is normalized and partitioned; if a target
 * column count is configured, feature selection picks the input columns using trial training runs on the
 * learning and validation sets; and finally a fresh predictor is trained on the selected columns.  If the
 * selection is interrupted, the final training is skipped.
 *
 * @author Bruce Parrello
 *
 */
public class ModelBuilder {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    // FIELDS
    /** tuning parameters */
    private final TrainingParameters parms;
    /** source of untrained predictors */
    private final IPredictor.Factory factory;
    /** progress reporter for the final training run */
    private ITrainReporter monitor;

    /**
     * Construct a model builder.
     *
     * @param parms		tuning parameters
     * @param factory	source of untrained predictors
     */
    public ModelBuilder(TrainingParameters parms, IPredictor.Factory factory) {
        this.parms = parms;
        this.factory = factory;
        this.monitor = new NullTrainReporter();
    }

    /**
     * Specify a progress reporter for the final training run.
     *
     * @param monitor	reporter to receive epoch progress
     */
    public ModelBuilder setReporter(ITrainReporter monitor) {
        this.monitor = monitor;
        return this;
    }

    /**
     * Build a model from a dataset.
     *
     * @param dataset		raw dataset
     * @param partitioner	strategy for assigning rows to subsets
     *
     * @return the selection and training results
     */
    public Result build(Dataset dataset, DatasetPartitioner partitioner) {
        log.info("Building model from {} rows with {} inputs.", dataset.size(), dataset.getInputNames().size());
        SelectionResult selection = null;
        Dataset working = dataset;
        int k = this.parms.getTargetCount();
        if (k > 0) {
            // Selection runs on the same normalized partition the final model will see.
            Partition partition = TrainingOrchestrator.prepare(dataset, partitioner).getPartition();
            TrainingSubsetEvaluator evaluator = new TrainingSubsetEvaluator(partition, this.factory, this.parms);
            FeatureSelector selector = new FeatureSelector(evaluator).setParallel(this.parms.isParallel());
            selection = selector.select(dataset.getInputNames(), k);
            List<String> retained = selection.getRetained();
            if (! selection.isComplete() || retained.isEmpty()) {
                log.warn("Feature selection stopped after {} of {} columns.  Final training skipped.",
                        retained.size(), k);
                return new Result(selection, null);
            }
            log.info("Selected input columns: {}.", retained);
            working = dataset.selectInputs(retained);
        }
        IPredictor predictor = this.factory.create(working.getInputNames().size(), working.getOutputNames().size());
        TrainingOrchestrator trainer = new TrainingOrchestrator(this.parms).setReporter(this.monitor);
        TrainingResult training = trainer.run(working, partitioner, predictor);
        log.info("Final model trained.  {} after {} epochs.", training.getState(), training.getEpochCount());
        return new Result(selection, training);
    }

    /**
     * This object holds the results of a model build.
     */
    public static class Result {

        /** feature selection result, or NULL if no selection was performed */
        private final SelectionResult selection;
        /** final training result, or NULL if the selection did not finish */
        private final TrainingResult training;

        /**
         * Construct a build result.
         *
         * @param selection		feature selection result, or NULL
         * @param training		final training result, or NULL
         */
        public Result(SelectionResult selection, TrainingResult training) {
            this.selection = selection;
            this.training = training;
        }

        /**
         * @return the feature selection result, or NULL if no selection was performed
         */
        public SelectionResult getSelection() {
            return this.selection;
        }

        /**
         * @return the final training result, or NULL if the selection did not finish
         */
        public TrainingResult getTraining() {
            return this.training;
        }

        /**
         * @return TRUE if the final model was trained
         */
        public boolean isComplete() {
            return this.training != null;
        }

    }

}
