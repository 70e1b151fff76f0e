package net.langexplorer.util.config;

/**
 * Typed accessors over a Configuration.
 * Missing (or blank) values yield the given default; malformed ones an
 * IllegalArgumentException naming the key.
 */
public final class ConfigValues {

    private ConfigValues() {}

    private static String lookup(Configuration cfg, String key) {
        String ret = cfg.get(key);
        if (ret == null) return null;
        ret = ret.trim();
        return ret.isEmpty() ? null : ret;
    }

    public static long getLong(Configuration cfg, String key, long dflt) {
        String v = lookup(cfg, key);
        if (v == null) return dflt;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid integer for " +
                "configuration key " + key + ": " + v, exc);
        }
    }

    public static int getInt(Configuration cfg, String key, int dflt) {
        long ret = getLong(cfg, key, dflt);
        if (ret < Integer.MIN_VALUE || ret > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Value out of range for " +
                "configuration key " + key + ": " + ret);
        return (int) ret;
    }

    public static boolean getBoolean(Configuration cfg, String key,
                                     boolean dflt) {
        String v = lookup(cfg, key);
        if (v == null) return dflt;
        if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes") ||
                v.equals("1"))
            return true;
        if (v.equalsIgnoreCase("false") || v.equalsIgnoreCase("no") ||
                v.equals("0"))
            return false;
        throw new IllegalArgumentException("Invalid boolean for " +
            "configuration key " + key + ": " + v);
    }

    /**
     * Parse an enum constant; case is ignored and dashes stand for
     * underscores.
     */
    public static <E extends Enum<E>> E getEnum(Configuration cfg,
            String key, Class<E> cls, E dflt) {
        String v = lookup(cfg, key);
        if (v == null) return dflt;
        String name = v.toUpperCase().replace('-', '_');
        for (E e : cls.getEnumConstants()) {
            if (e.name().equals(name)) return e;
        }
        throw new IllegalArgumentException("Invalid value for " +
            "configuration key " + key + ": " + v);
    }

}
