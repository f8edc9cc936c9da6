package org.publicip;

import java.util.Properties;

/**
 * Fluent builder of configuration property sets.
 */
public final class PropertiesBuilder {
    private final Properties _properties;

    public PropertiesBuilder() {
        _properties = new Properties();
    }

    public PropertiesBuilder(Properties defaults) {
        _properties = new Properties();
        _properties.putAll(defaults);
    }

    public PropertiesBuilder add(String key, String value) {
        _properties.setProperty(key, value);
        return this;
    }

    public PropertiesBuilder addIfAbsent(String key, String value) {
        _properties.putIfAbsent(key, value);
        return this;
    }

    public Properties get() {
        return _properties;
    }
}
