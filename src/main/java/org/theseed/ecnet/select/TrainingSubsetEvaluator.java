/**
 *
 */
package org.theseed.ecnet.select;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.data.Partition;
import org.theseed.ecnet.train.IPredictor;
import org.theseed.ecnet.train.TrainingOrchestrator;
import org.theseed.ecnet.train.TrainingParameters;
import org.theseed.ecnet.train.TrainingResult;

/**
 * This evaluator scores a column subset by training a fresh predictor on the learning set using only those
 * columns, under the normal convergence rules, and returning the final validation RMSE.  The partition must
 * already be normalized.  If the trial run is interrupted, the score is NaN.
 *
 * Each evaluation builds its own predictor and its own reduced data, so evaluations can run in parallel as long
 * as the predictor factory is thread-safe.
 *
 * @author Bruce Parrello
 *
 */
public class TrainingSubsetEvaluator implements ISubsetEvaluator {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TrainingSubsetEvaluator.class);

    // FIELDS
    /** normalized data partition */
    private final Partition partition;
    /** source of fresh predictors */
    private final IPredictor.Factory factory;
    /** training orchestrator */
    private final TrainingOrchestrator trainer;

    /**
     * Construct a training evaluator.
     *
     * @param partition		normalized data partition containing all candidate columns
     * @param factory		factory for creating untrained predictors
     * @param parms			tuning parameters for the trial training runs
     */
    public TrainingSubsetEvaluator(Partition partition, IPredictor.Factory factory, TrainingParameters parms) {
        this.partition = partition;
        this.factory = factory;
        this.trainer = new TrainingOrchestrator(parms);
    }

    @Override
    public double evaluate(List<String> columns) {
        Partition reduced = this.partition.selectInputs(columns);
        IPredictor predictor = this.factory.create(columns.size(), reduced.getLearn().getOutputNames().size());
        TrainingResult result = this.trainer.train(reduced, predictor);
        double retVal = Double.NaN;
        if (result.isComplete())
            retVal = result.getFinalError();
        else
            log.debug("Trial run for {} was interrupted after {} epochs.", columns, result.getEpochCount());
        return retVal;
    }

}
