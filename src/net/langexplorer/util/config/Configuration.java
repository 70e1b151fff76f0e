package net.langexplorer.util.config;

public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /**
     * The value for key, or null if it is not configured.
     */
    String get(String key);

}
