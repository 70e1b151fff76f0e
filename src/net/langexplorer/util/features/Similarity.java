package net.langexplorer.util.features;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Structural distances and similarities between program trees.
 */
public final class Similarity {

    private Similarity() {}

    /**
     * Distance between two feature multisets.
     * Each distinct feature contributes the difference of its occurrence
     * counts in a and b.
     */
    public static double wlTest(List<Long> a, List<Long> b,
                                VectorSimilarity similarity) {
        Map<Long, int[]> counts = new LinkedHashMap<Long, int[]>();
        for (Long f : a) countFor(counts, f)[0]++;
        for (Long f : b) countFor(counts, f)[1]++;
        double[] diffs = new double[counts.size()];
        int i = 0;
        for (int[] c : counts.values()) diffs[i++] = c[0] - c[1];
        return similarity.combine(diffs);
    }

    public static double wlTest(ProgramInstance<?, ?> a,
            ProgramInstance<?, ?> b, HashingOrder order,
            VectorSimilarity similarity, int iterations, boolean dedup,
            boolean sort) {
        return wlTest(
            FeatureExtractor.extract(a, iterations, order, dedup, sort),
            FeatureExtractor.extract(b, iterations, order, dedup, sort),
            similarity);
    }

    private static int[] countFor(Map<Long, int[]> counts, Long feature) {
        int[] ret = counts.get(feature);
        if (ret == null) {
            ret = new int[2];
            counts.put(feature, ret);
        }
        return ret;
    }

    /**
     * Recursive SimRank over the children of a and b, with decay c and at
     * most depth levels of recursion.
     */
    public static double simRank(ProgramInstance<?, ?> a,
            ProgramInstance<?, ?> b, double c, int depth) {
        List<? extends ProgramInstance<?, ?>> ca = a.getChildren();
        List<? extends ProgramInstance<?, ?>> cb = b.getChildren();
        if (a.getNode().equals(b.getNode()) && ca.isEmpty() && cb.isEmpty())
            return 1.0;
        if (ca.isEmpty() || cb.isEmpty() || depth <= 0)
            return 0.0;
        double sum = 0;
        for (ProgramInstance<?, ?> v : ca) {
            for (ProgramInstance<?, ?> w : cb) {
                sum += simRank(v, w, c, depth - 1);
            }
        }
        return c * sum / ((double) ca.size() * cb.size());
    }

    /**
     * Distance between two embedding vectors of equal length.
     */
    public static double vectorSimilarity(float[] a, float[] b,
                                          VectorSimilarity similarity) {
        if (a.length != b.length)
            throw new IllegalArgumentException("Vector lengths differ: " +
                a.length + " vs. " + b.length);
        double[] diffs = new double[a.length];
        for (int i = 0; i < a.length; i++) diffs[i] = a[i] - b[i];
        return similarity.combine(diffs);
    }

}
