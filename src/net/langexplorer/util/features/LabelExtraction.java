package net.langexplorer.util.features;

import org.json.JSONObject;

/**
 * Parameters of a WL feature extraction.
 */
public class LabelExtraction {

    public static final int DEFAULT_ITERATIONS = 3;

    public static final LabelExtraction DEFAULT = new LabelExtraction(
        DEFAULT_ITERATIONS, HashingOrder.SELF_CHILDREN_PARENT, false, false);

    private final int iterations;
    private final HashingOrder order;
    private final boolean dedup;
    private final boolean sort;

    public LabelExtraction(int iterations, HashingOrder order, boolean dedup,
                           boolean sort) {
        if (iterations < 0)
            throw new IllegalArgumentException(
                "Iteration count may not be negative");
        if (order == null)
            throw new NullPointerException(
                "LabelExtraction order may not be null");
        this.iterations = iterations;
        this.order = order;
        this.dedup = dedup;
        this.sort = sort;
    }

    public String toString() {
        return String.format("%s@%h[iterations=%s,order=%s,dedup=%s," +
            "sort=%s]", getClass().getName(), this, getIterations(),
            getOrder(), isDedup(), isSort());
    }

    public int getIterations() {
        return iterations;
    }

    public HashingOrder getOrder() {
        return order;
    }

    public boolean isDedup() {
        return dedup;
    }

    public boolean isSort() {
        return sort;
    }

    public JSONObject toJSON() {
        JSONObject ret = new JSONObject();
        ret.put("iterations", iterations);
        ret.put("order", order.name());
        ret.put("dedup", dedup);
        ret.put("sort", sort);
        return ret;
    }

}
