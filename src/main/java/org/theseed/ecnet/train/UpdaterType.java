/**
 *
 */
package org.theseed.ecnet.train;

import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.learning.config.IUpdater;
import org.nd4j.linalg.learning.config.Nadam;
import org.nd4j.linalg.learning.config.Nesterovs;
import org.nd4j.linalg.learning.config.Sgd;

/**
 * This enumeration lists the gradient updaters available to the network predictor.  Each value can create the
 * corresponding DL4J updater for a given learning rate.
 *
 * @author Bruce Parrello
 *
 */
public enum UpdaterType {
    ADAM {
        @Override
        public IUpdater create(double learningRate) {
            return new Adam(learningRate);
        }
    }, NADAM {
        @Override
        public IUpdater create(double learningRate) {
            return new Nadam(learningRate);
        }
    }, NESTEROVS {
        @Override
        public IUpdater create(double learningRate) {
            return new Nesterovs(learningRate, Nesterovs.DEFAULT_NESTEROV_MOMENTUM);
        }
    }, SGD {
        @Override
        public IUpdater create(double learningRate) {
            return new Sgd(learningRate);
        }
    };

    /**
     * @return an updater of this type with the specified learning rate
     *
     * @param learningRate	learning rate parameter
     */
    public abstract IUpdater create(double learningRate);

}
