package net.langexplorer.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A configuration layered from explicit values and a list of sources.
 * Explicitly put values take precedence; otherwise the sources are asked
 * in order and the first non-null answer is cached.
 */
public class DynamicConfiguration implements Configuration {

    public static final String ENV_PREFIX = "LANGEXPLORER_";

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(envName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public synchronized String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        if (ret != null) data.put(key, ret);
        return ret;
    }

    public synchronized void put(String key, String value) {
        data.put(key, value);
    }

    public synchronized void remove(String key) {
        data.remove(key);
    }

    public synchronized void addSource(Configuration source) {
        sources.add(source);
    }

    /**
     * The environment variable consulted for key: the key with a leading
     * "langexplorer." stripped, upper-cased, with dots and dashes turned
     * into underscores, and prefixed with LANGEXPLORER_.
     */
    public static String envName(String key) {
        String base = key;
        if (base.startsWith("langexplorer."))
            base = base.substring("langexplorer.".length());
        return ENV_PREFIX + base.toUpperCase().replace('.', '_')
                                .replace('-', '_');
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
