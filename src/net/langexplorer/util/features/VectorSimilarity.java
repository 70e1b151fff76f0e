package net.langexplorer.util.features;

public enum VectorSimilarity {

    EUCLIDEAN {
        public double combine(double[] diffs) {
            double sum = 0;
            for (double d : diffs) sum += d * d;
            return Math.sqrt(sum);
        }
    },

    MANHATTAN {
        public double combine(double[] diffs) {
            double sum = 0;
            for (double d : diffs) sum += Math.abs(d);
            return sum;
        }
    };

    /**
     * Reduce per-component differences to a distance.
     */
    public abstract double combine(double[] diffs);

}
