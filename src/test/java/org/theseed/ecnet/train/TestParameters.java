/**
 *
 */
package org.theseed.ecnet.train;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.kohsuke.args4j.CmdLineException;
import org.nd4j.linalg.activations.Activation;
import org.theseed.ecnet.EcnetException;
import org.theseed.ecnet.data.SplitRatio;

/**
 * @author Bruce Parrello
 *
 */
public class TestParameters {

    @Test
    public void testDefaults() throws CmdLineException {
        TrainingParameters parms = TrainingParameters.parse();
        assertThat(parms.getMemory(), equalTo(10));
        assertThat(parms.getStopThreshold(), equalTo(1e-5));
        assertThat(parms.getMaxEpochs(), equalTo(1000));
        assertThat(parms.getSeed(), equalTo(42L));
        assertThat(parms.getHiddenLayerWidths(), equalTo(new int[] { 5, 5 }));
        assertThat(parms.getActivation(), equalTo(Activation.RELU));
        assertThat(parms.getUpdater(), equalTo(UpdaterType.ADAM));
        assertThat(parms.getBatchSize(), equalTo(32));
        assertThat(parms.getTargetCount(), equalTo(0));
        assertThat(parms.isParallel(), equalTo(false));
        SplitRatio ratio = parms.getSplitRatio();
        assertThat(ratio.getLearn(), equalTo(0.7));
        assertThat(ratio.getValidation(), equalTo(0.2));
        assertThat(ratio.getTest(), equalTo(0.1));
        ConvergenceController controller = parms.createController();
        assertThat(controller.getMemory(), equalTo(10));
        assertThat(controller.getStopThreshold(), equalTo(1e-5));
        assertThat(controller.getMaxEpochs(), equalTo(1000));
    }

    @Test
    public void testOptions() throws CmdLineException {
        TrainingParameters parms = TrainingParameters.parse("--memory", "4", "--stop", "0.001", "-e", "250",
                "--seed", "1234", "--learn", "0.6", "--valid", "0.3", "--test", "0.1", "-w", "8, 4, 2",
                "-a", "TANH", "--rate", "0.05", "--updater", "SGD", "-b", "16", "-k", "3", "--parallel");
        assertThat(parms.getMemory(), equalTo(4));
        assertThat(parms.getStopThreshold(), equalTo(0.001));
        assertThat(parms.getMaxEpochs(), equalTo(250));
        assertThat(parms.getSeed(), equalTo(1234L));
        assertThat(parms.getSplitRatio().getValidation(), equalTo(0.3));
        assertThat(parms.getHiddenLayerWidths(), equalTo(new int[] { 8, 4, 2 }));
        assertThat(parms.getActivation(), equalTo(Activation.TANH));
        assertThat(parms.getLearningRate(), equalTo(0.05));
        assertThat(parms.getUpdater(), equalTo(UpdaterType.SGD));
        assertThat(parms.getBatchSize(), equalTo(16));
        assertThat(parms.getTargetCount(), equalTo(3));
        assertThat(parms.isParallel(), equalTo(true));
        assertThat(parms.toString(), containsString("parallel"));
        parms = TrainingParameters.parse("--widths", "none");
        assertThat(parms.getHiddenLayerWidths().length, equalTo(0));
    }

    @Test
    public void testFluent() {
        TrainingParameters parms = new TrainingParameters().setMemory(2).setStopThreshold(0.5).setMaxEpochs(9)
                .setSplit(0.5, 0.5, 0.0).setHiddenLayers("3").setSeed(7);
        assertThat(parms.getHiddenLayerWidths(), equalTo(new int[] { 3 }));
        assertThat(parms.getSplitRatio().getTest(), equalTo(0.0));
        assertThat(parms.createController().getMaxEpochs(), equalTo(9));
        assertThat(parms.getSeed(), equalTo(7L));
    }

    @Test
    public void testBadOptions() {
        assertThrows(CmdLineException.class, () -> TrainingParameters.parse("--widths", "5,x"));
        assertThrows(CmdLineException.class, () -> TrainingParameters.parse("--widths", "5,0"));
        assertThrows(CmdLineException.class, () -> TrainingParameters.parse("--memory", "many"));
        assertThrows(CmdLineException.class, () -> TrainingParameters.parse("--bogus"));
        // The split is only checked when it is used.
        TrainingParameters parms = new TrainingParameters().setSplit(0.5, 0.5, 0.5);
        EcnetException e = assertThrows(EcnetException.class, () -> parms.getSplitRatio());
        assertThat(e.getType(), equalTo(EcnetException.Type.INVALID_SPLIT_RATIO));
        TrainingParameters parms2 = new TrainingParameters().setMemory(0);
        assertThrows(IllegalArgumentException.class, () -> parms2.createController());
    }

}
