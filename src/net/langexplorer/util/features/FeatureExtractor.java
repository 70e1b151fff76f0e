package net.langexplorer.util.features;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.primitives.UnsignedLongs;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import net.langexplorer.util.Encodings;
import net.langexplorer.util.grammar.ProgramInstance;

/**
 * Weisfeiler-Lehman subtree features of program trees.
 * Every node starts out labelled with a 64-bit fingerprint of its own
 * bytes; each round relabels it with a hash over its own bytes and its
 * neighbours' previous labels. The features are all labels of all
 * rounds.
 */
public final class FeatureExtractor {

    private static final HashFunction HASH = Hashing.farmHashFingerprint64();

    private static final byte[] NO_PARENT = new byte[8];

    private FeatureExtractor() {}

    public static List<Long> extract(ProgramInstance<?, ?> tree,
                                     LabelExtraction params) {
        return extract(tree, params.getIterations(), params.getOrder(),
                       params.isDedup(), params.isSort());
    }

    public static List<Long> extract(ProgramInstance<?, ?> tree,
            int iterations, HashingOrder order, boolean dedup, boolean sort) {
        if (iterations < 0)
            throw new IllegalArgumentException(
                "Iteration count may not be negative");
        List<? extends ProgramInstance<?, ?>> nodes = tree.getAllNodes();
        int n = nodes.size();
        Map<Long, Integer> byId = new HashMap<Long, Integer>();
        for (int i = 0; i < n; i++) byId.put(nodes.get(i).getId(), i);
        int[] parents = new int[n];
        int[][] children = new int[n][];
        byte[][] own = new byte[n][];
        for (int i = 0; i < n; i++) {
            ProgramInstance<?, ?> node = nodes.get(i);
            Integer p = (node.getParentId() == null) ? null :
                byId.get(node.getParentId());
            parents[i] = (p == null || i == 0) ? -1 : p;
            List<? extends ProgramInstance<?, ?>> cl = node.getChildren();
            children[i] = new int[cl.size()];
            for (int j = 0; j < cl.size(); j++) {
                children[i][j] = byId.get(cl.get(j).getId());
            }
            own[i] = node.serializeNode();
        }

        long[] labels = new long[n];
        List<Long> ret = new ArrayList<Long>(n * (iterations + 1));
        for (int i = 0; i < n; i++) {
            labels[i] = HASH.hashBytes(own[i]).asLong();
            ret.add(labels[i]);
        }
        for (int round = 0; round < iterations; round++) {
            long[] next = new long[n];
            for (int i = 0; i < n; i++) {
                next[i] = relabel(order, own[i], labels, parents[i],
                                  children[i]);
                ret.add(next[i]);
            }
            labels = next;
        }

        if (dedup) ret = new ArrayList<Long>(new LinkedHashSet<Long>(ret));
        if (sort) {
            long[] arr = new long[ret.size()];
            for (int i = 0; i < arr.length; i++) arr[i] = ret.get(i);
            UnsignedLongs.sort(arr);
            ret.clear();
            for (long l : arr) ret.add(l);
        }
        return ret;
    }

    private static long relabel(HashingOrder order, byte[] own,
                                long[] labels, int parent, int[] children) {
        long[] childLabels = new long[children.length];
        for (int j = 0; j < children.length; j++) {
            childLabels[j] = labels[children[j]];
        }
        UnsignedLongs.sort(childLabels);
        byte[] parentBytes = (parent == -1) ? NO_PARENT :
            Encodings.toLittleEndian(labels[parent]);
        Hasher h = HASH.newHasher();
        switch (order) {
            case SELF_CHILDREN_PARENT:
                h.putBytes(own);
                putLabels(h, childLabels);
                h.putBytes(parentBytes);
                break;
            case PARENT_SELF_CHILDREN:
                h.putBytes(parentBytes);
                h.putBytes(own);
                putLabels(h, childLabels);
                break;
            case TOTAL_ORDERED:
                putLabels(h, childLabels);
                break;
        }
        return h.hash().asLong();
    }

    private static void putLabels(Hasher h, long[] labels) {
        for (long l : labels) h.putBytes(Encodings.toLittleEndian(l));
    }

}
