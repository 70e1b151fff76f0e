package net.langexplorer.expanders;

/**
 * Turns raw policy scores into a (possibly logarithmic) distribution.
 */
public enum NormalizationStrategy {

    SOFTMAX {
        public double[] normalize(double[] scores) {
            double max = max(scores);
            double[] ret = new double[scores.length];
            double sum = 0;
            for (int i = 0; i < scores.length; i++) {
                ret[i] = Math.exp(scores[i] - max);
                sum += ret[i];
            }
            for (int i = 0; i < ret.length; i++) ret[i] /= sum;
            return ret;
        }

        public double[] toProbabilities(double[] normalized) {
            return normalized.clone();
        }
    },

    LOG_SOFTMAX {
        public double[] normalize(double[] scores) {
            double max = max(scores);
            double sum = 0;
            for (double s : scores) sum += Math.exp(s - max);
            double logSum = max + Math.log(sum);
            double[] ret = new double[scores.length];
            for (int i = 0; i < scores.length; i++) {
                ret[i] = scores[i] - logSum;
            }
            return ret;
        }

        public double[] toProbabilities(double[] normalized) {
            double[] ret = new double[normalized.length];
            for (int i = 0; i < ret.length; i++) {
                ret[i] = Math.exp(normalized[i]);
            }
            return ret;
        }
    };

    public abstract double[] normalize(double[] scores);

    /**
     * Map the output of normalize() back to plain probabilities.
     */
    public abstract double[] toProbabilities(double[] normalized);

    private static double max(double[] scores) {
        if (scores.length == 0)
            throw new IllegalArgumentException("No scores to normalize");
        double ret = Double.NEGATIVE_INFINITY;
        for (double s : scores) ret = Math.max(ret, s);
        return ret;
    }

}
