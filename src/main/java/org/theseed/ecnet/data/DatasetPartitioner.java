/**
 *
 */
package org.theseed.ecnet.data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.EcnetException;

/**
 * This object assigns each sample of a dataset to exactly one of the learning, validation, and testing
 * subsets.  The subclass determines how the labels are chosen:  "RandomPartitioner" shuffles the rows with a seeded
 * random-number generator, and "Explicit" uses assignments supplied by the client or stored in the rows.
 * Once the labels are known, {@link #apply(Dataset, PartitionLabel[])} splits the dataset.
 *
 * @author Bruce Parrello
 *
 */
public abstract class DatasetPartitioner {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DatasetPartitioner.class);

    /**
     * @return the partition label for each row of the dataset
     *
     * @param dataset	dataset to partition
     */
    public abstract PartitionLabel[] computeLabels(Dataset dataset);

    /**
     * Partition a dataset using this object's labeling strategy.
     *
     * @param dataset	dataset to partition
     *
     * @return the three subsets
     */
    public Partition partition(Dataset dataset) {
        return apply(dataset, this.computeLabels(dataset));
    }

    /**
     * Split a dataset into subsets according to precomputed labels.  Row order within each subset is the
     * same as in the original.
     *
     * @param dataset	dataset to split
     * @param labels	label for each row
     *
     * @return the three subsets
     *
     * @throws EcnetException if the number of labels does not match the number of rows
     */
    public static Partition apply(Dataset dataset, PartitionLabel[] labels) {
        final int n = dataset.size();
        if (labels.length != n)
            throw new EcnetException(EcnetException.Type.DIMENSION_MISMATCH,
                    String.format("There are %d partition labels for %d rows.", labels.length, n));
        // Collect the row indices for each subset.
        Map<PartitionLabel, List<Integer>> idxMap = new EnumMap<PartitionLabel, List<Integer>>(PartitionLabel.class);
        for (PartitionLabel label : PartitionLabel.values())
            idxMap.put(label, new ArrayList<Integer>());
        for (int i = 0; i < n; i++) {
            if (labels[i] == null)
                throw new EcnetException(EcnetException.Type.INVALID_LABEL, "Row " + i + " has no partition label.");
            idxMap.get(labels[i]).add(i);
        }
        // Verify that every row was used exactly once.
        int[] counts = new int[n];
        for (List<Integer> idxList : idxMap.values())
            idxList.forEach(i -> counts[i]++);
        if (IntStream.of(counts).anyMatch(c -> c != 1))
            throw new IllegalStateException("Partition did not place every row in exactly one subset.");
        Dataset learn = dataset.subset(toArray(idxMap.get(PartitionLabel.LEARN)));
        Dataset validation = dataset.subset(toArray(idxMap.get(PartitionLabel.VALIDATION)));
        Dataset test = dataset.subset(toArray(idxMap.get(PartitionLabel.TEST)));
        log.info("Partitioned {} rows into {} learning, {} validation, and {} testing.", n, learn.size(),
                validation.size(), test.size());
        return new Partition(learn, validation, test, labels);
    }

    /**
     * @return an array of integers copied from a list
     *
     * @param list	list to convert
     */
    private static int[] toArray(List<Integer> list) {
        return list.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * This partitioner shuffles the row indices and hands out the first part of the permutation to the
     * learning set and the next part to the validation set.  The testing set gets the remainder, so every
     * row is assigned even when the fractions do not divide the row count evenly.  The same seed and the same
     * row count always produce the same labels.
     */
    public static class RandomPartitioner extends DatasetPartitioner {

        // FIELDS
        /** desired subset fractions */
        private final SplitRatio ratio;
        /** random-number seed */
        private final long seed;

        /**
         * Construct a random partitioner.
         *
         * @param ratio		desired subset fractions
         * @param seed		seed for the random-number generator
         */
        public RandomPartitioner(SplitRatio ratio, long seed) {
            this.ratio = ratio;
            this.seed = seed;
        }

        @Override
        public PartitionLabel[] computeLabels(Dataset dataset) {
            return this.computeLabels(dataset.size());
        }

        /**
         * @return the partition labels for a dataset of the specified size
         *
         * @param n		number of rows to label
         */
        public PartitionLabel[] computeLabels(int n) {
            int[] shuffler = IntStream.range(0, n).toArray();
            Random rand = new Random(this.seed);
            for (int i = n - 1; i > 0; i--) {
                int j = rand.nextInt(i + 1);
                int buffer = shuffler[i];
                shuffler[i] = shuffler[j];
                shuffler[j] = buffer;
            }
            int learnCount = this.ratio.learnCount(n);
            int validCount = this.ratio.validationCount(n);
            PartitionLabel[] retVal = new PartitionLabel[n];
            for (int i = 0; i < n; i++) {
                PartitionLabel label;
                if (i < learnCount)
                    label = PartitionLabel.LEARN;
                else if (i < learnCount + validCount)
                    label = PartitionLabel.VALIDATION;
                else
                    label = PartitionLabel.TEST;
                retVal[shuffler[i]] = label;
            }
            return retVal;
        }

        /**
         * @return the split ratio
         */
        public SplitRatio getRatio() {
            return this.ratio;
        }

        /**
         * @return the random-number seed
         */
        public long getSeed() {
            return this.seed;
        }

    }

    /**
     * This partitioner uses assignments chosen by the client.  The assignments can be passed in as strings,
     * or, if none are passed in, they are taken from the rows of the dataset.
     */
    public static class Explicit extends DatasetPartitioner {

        // FIELDS
        /** assignment strings, or NULL to use the dataset's own */
        private final List<String> assignments;

        /**
         * Construct a partitioner that uses the assignments stored in the dataset rows.
         */
        public Explicit() {
            this.assignments = null;
        }

        /**
         * Construct a partitioner that uses the specified assignment strings.
         *
         * @param assignments	assignment string for each row, in row order
         */
        public Explicit(List<String> assignments) {
            this.assignments = List.copyOf(assignments);
        }

        @Override
        public PartitionLabel[] computeLabels(Dataset dataset) {
            List<String> strings = (this.assignments != null ? this.assignments : dataset.getAssignments());
            if (strings.size() != dataset.size())
                throw new EcnetException(EcnetException.Type.DIMENSION_MISMATCH,
                        String.format("There are %d assignments for %d rows.", strings.size(), dataset.size()));
            PartitionLabel[] retVal = new PartitionLabel[strings.size()];
            for (int i = 0; i < retVal.length; i++) {
                try {
                    retVal[i] = PartitionLabel.parse(strings.get(i));
                } catch (EcnetException e) {
                    throw new EcnetException(EcnetException.Type.INVALID_LABEL,
                            "Row " + dataset.getRow(i).getId() + ": " + e.getMessage());
                }
            }
            return retVal;
        }

    }

}
