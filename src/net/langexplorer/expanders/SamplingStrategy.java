package net.langexplorer.expanders;

import java.util.Random;

/**
 * Picks an index given a normalized distribution.
 */
public enum SamplingStrategy {

    HIGHEST_PROB {
        public int choose(double[] normalized,
                          NormalizationStrategy normalization,
                          Random random) {
            int ret = 0;
            for (int i = 1; i < normalized.length; i++) {
                if (normalized[i] > normalized[ret]) ret = i;
            }
            return ret;
        }
    },

    LOWEST_PROB {
        public int choose(double[] normalized,
                          NormalizationStrategy normalization,
                          Random random) {
            int ret = 0;
            for (int i = 1; i < normalized.length; i++) {
                if (normalized[i] < normalized[ret]) ret = i;
            }
            return ret;
        }
    },

    SAMPLE {
        public int choose(double[] normalized,
                          NormalizationStrategy normalization,
                          Random random) {
            double[] probs = normalization.toProbabilities(normalized);
            double u = random.nextDouble();
            double cumsum = 0;
            for (int i = 0; i < probs.length; i++) {
                cumsum += probs[i];
                if (u <= cumsum) return i;
            }
            return probs.length - 1;
        }
    };

    /* Ties resolve to the lowest index. */
    public abstract int choose(double[] normalized,
                               NormalizationStrategy normalization,
                               Random random);

}
