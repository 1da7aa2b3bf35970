package socs.routing.util;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Read-only view over the routing settings. Anything a file leaves out falls back to the
 * defaults in reference.conf.
 */
public class Configuration {
    private final Config _config;

    public Configuration(String path) {
        this(ConfigFactory.parseFile(new File(path)));
    }

    private Configuration(Config config) {
        _config = config.withFallback(ConfigFactory.defaultReference()).resolve();
    }

    /**
     * @return the classpath defaults, overridden by any application.conf and system properties
     */
    public static Configuration load() {
        return new Configuration(ConfigFactory.load());
    }

    public static Configuration fromResource(String resourceName) {
        return new Configuration(ConfigFactory.parseResources(resourceName));
    }

    public String getString(String key) {
        return _config.getString(key);
    }

    public Ipv4Address getAddress(String key) {
        try {
            return Ipv4Address.parse(_config.getString(key));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(key, e.getMessage(), e);
        }
    }

    /**
     * @param key the metric setting
     * @return the metric, checked against the unsigned 32 bit range
     */
    public long getMetric(String key) {
        try {
            return RouterUtils.checkMetric(_config.getLong(key));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(key, e.getMessage(), e);
        }
    }
}
