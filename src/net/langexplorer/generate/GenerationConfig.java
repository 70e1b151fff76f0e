package net.langexplorer.generate;

import net.langexplorer.util.config.ConfigValues;
import net.langexplorer.util.config.Configuration;
import net.langexplorer.util.features.HashingOrder;
import net.langexplorer.util.features.LabelExtraction;
import org.json.JSONObject;

/**
 * Options of one batch generation run.
 */
public class GenerationConfig {

    public static final String PREFIX = "langexplorer.generate.";

    public static final String KEY_COUNT = PREFIX + "count";
    public static final String KEY_SEED = PREFIX + "seed";
    public static final String KEY_WORKERS = PREFIX + "workers";
    public static final String KEY_MAX_ATTEMPTS = PREFIX + "max-attempts";
    public static final String KEY_RETURN_FEATURES =
        PREFIX + "return-features";
    public static final String KEY_RETURN_EDGE_LISTS =
        PREFIX + "return-edge-lists";
    public static final String KEY_RETURN_GRAPHVIZ =
        PREFIX + "return-graphviz";
    public static final String KEY_RETURN_PARTIALS =
        PREFIX + "return-partials";
    public static final String KEY_RETURN_GRAMMAR = PREFIX + "return-grammar";
    public static final String KEY_WL_ITERATIONS = PREFIX + "wl.iterations";
    public static final String KEY_WL_ORDER = PREFIX + "wl.order";
    public static final String KEY_WL_DEDUP = PREFIX + "wl.dedup";
    public static final String KEY_WL_SORT = PREFIX + "wl.sort";

    private int count;
    private long seed;
    private int workers;
    private long maxAttempts;
    private boolean returnFeatures;
    private boolean returnEdgeLists;
    private boolean returnGraphviz;
    private boolean returnPartials;
    private boolean returnGrammar;
    private LabelExtraction labelExtraction;

    public GenerationConfig() {
        count = 1;
        seed = 0;
        workers = defaultWorkers();
        maxAttempts = 0;
        labelExtraction = LabelExtraction.DEFAULT;
    }

    public String toString() {
        return String.format("%s@%h%s", getClass().getName(), this,
                             toJSON());
    }

    public int getCount() {
        return count;
    }
    public GenerationConfig setCount(int count) {
        if (count < 0)
            throw new IllegalArgumentException(
                "Program count may not be negative");
        this.count = count;
        return this;
    }

    public long getSeed() {
        return seed;
    }
    public GenerationConfig setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public int getWorkers() {
        return workers;
    }
    public GenerationConfig setWorkers(int workers) {
        if (workers < 1)
            throw new IllegalArgumentException(
                "Worker count must be positive");
        this.workers = workers;
        return this;
    }

    /**
     * The maximum number of generation attempts per worker, or 0 for no
     * limit.
     */
    public long getMaxAttempts() {
        return maxAttempts;
    }
    public GenerationConfig setMaxAttempts(long maxAttempts) {
        if (maxAttempts < 0)
            throw new IllegalArgumentException(
                "Attempt limit may not be negative");
        this.maxAttempts = maxAttempts;
        return this;
    }

    public boolean isReturnFeatures() {
        return returnFeatures;
    }
    public GenerationConfig setReturnFeatures(boolean returnFeatures) {
        this.returnFeatures = returnFeatures;
        return this;
    }

    public boolean isReturnEdgeLists() {
        return returnEdgeLists;
    }
    public GenerationConfig setReturnEdgeLists(boolean returnEdgeLists) {
        this.returnEdgeLists = returnEdgeLists;
        return this;
    }

    public boolean isReturnGraphviz() {
        return returnGraphviz;
    }
    public GenerationConfig setReturnGraphviz(boolean returnGraphviz) {
        this.returnGraphviz = returnGraphviz;
        return this;
    }

    public boolean isReturnPartials() {
        return returnPartials;
    }
    public GenerationConfig setReturnPartials(boolean returnPartials) {
        this.returnPartials = returnPartials;
        return this;
    }

    public boolean isReturnGrammar() {
        return returnGrammar;
    }
    public GenerationConfig setReturnGrammar(boolean returnGrammar) {
        this.returnGrammar = returnGrammar;
        return this;
    }

    public LabelExtraction getLabelExtraction() {
        return labelExtraction;
    }
    public GenerationConfig setLabelExtraction(LabelExtraction le) {
        if (le == null)
            throw new NullPointerException(
                "Label extraction may not be null");
        this.labelExtraction = le;
        return this;
    }

    public JSONObject toJSON() {
        JSONObject ret = new JSONObject();
        ret.put("count", count);
        ret.put("seed", seed);
        ret.put("workers", workers);
        ret.put("max_attempts", maxAttempts);
        ret.put("return_features", returnFeatures);
        ret.put("return_edge_lists", returnEdgeLists);
        ret.put("return_graphviz", returnGraphviz);
        ret.put("return_partials", returnPartials);
        ret.put("return_grammar", returnGrammar);
        ret.put("label_extraction", labelExtraction.toJSON());
        return ret;
    }

    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Read the options from system properties and the environment.
     */
    public static GenerationConfig fromEnvironment() {
        return fromConfiguration(Configuration.DEFAULT);
    }

    public static GenerationConfig fromConfiguration(Configuration cfg) {
        GenerationConfig ret = new GenerationConfig();
        ret.setCount(ConfigValues.getInt(cfg, KEY_COUNT, 1));
        ret.setSeed(ConfigValues.getLong(cfg, KEY_SEED, 0));
        ret.setWorkers(ConfigValues.getInt(cfg, KEY_WORKERS,
                                           defaultWorkers()));
        ret.setMaxAttempts(ConfigValues.getLong(cfg, KEY_MAX_ATTEMPTS, 0));
        ret.setReturnFeatures(ConfigValues.getBoolean(cfg,
            KEY_RETURN_FEATURES, false));
        ret.setReturnEdgeLists(ConfigValues.getBoolean(cfg,
            KEY_RETURN_EDGE_LISTS, false));
        ret.setReturnGraphviz(ConfigValues.getBoolean(cfg,
            KEY_RETURN_GRAPHVIZ, false));
        ret.setReturnPartials(ConfigValues.getBoolean(cfg,
            KEY_RETURN_PARTIALS, false));
        ret.setReturnGrammar(ConfigValues.getBoolean(cfg,
            KEY_RETURN_GRAMMAR, false));
        LabelExtraction d = LabelExtraction.DEFAULT;
        ret.setLabelExtraction(new LabelExtraction(
            ConfigValues.getInt(cfg, KEY_WL_ITERATIONS, d.getIterations()),
            ConfigValues.getEnum(cfg, KEY_WL_ORDER, HashingOrder.class,
                                 d.getOrder()),
            ConfigValues.getBoolean(cfg, KEY_WL_DEDUP, d.isDedup()),
            ConfigValues.getBoolean(cfg, KEY_WL_SORT, d.isSort())));
        return ret;
    }

}
