package net.langexplorer.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        if (base == null)
            throw new NullPointerException(
                "PropertiesConfiguration base may not be null");
        this.base = base;
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }

    public static PropertiesConfiguration fromFile(File path)
            throws IOException {
        return new PropertiesConfiguration(
            loadProperties(new FileInputStream(path)));
    }

    /**
     * Load a properties file from the class path of loader.
     */
    public static PropertiesConfiguration fromResource(ClassLoader loader,
            String name) throws IOException {
        InputStream in = loader.getResourceAsStream(name);
        if (in == null)
            throw new FileNotFoundException("Resource not found: " + name);
        return new PropertiesConfiguration(loadProperties(in));
    }

}
