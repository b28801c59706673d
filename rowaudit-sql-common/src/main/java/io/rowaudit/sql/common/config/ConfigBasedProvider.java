package io.rowaudit.sql.common.config;

import com.typesafe.config.Config;

/**
 * Instantiates the class named by {@code <prefix>.class}. The class either has a public constructor
 * taking the {@link Config} under {@code <prefix>}, or a public no-arg constructor.
 */
public final class ConfigBasedProvider {

    public static final String CLASS_KEY = "class";
    private static final Class<?>[] constructorParameterTypes = {Config.class};

    private ConfigBasedProvider() {
    }

    public static <T> T load(Config config, String prefixKey, Class<T> type, T defaultObject) throws Exception {
        if (!config.hasPath(prefixKey)) {
            return defaultObject;
        }
        var innerConfig = config.getConfig(prefixKey);
        if (!innerConfig.hasPath(CLASS_KEY)) {
            return defaultObject;
        }
        return instantiate(innerConfig, type);
    }

    public static <T> T load(Config config, String prefixKey, Class<T> type) throws Exception {
        if (!config.hasPath(prefixKey)) {
            throw new IllegalArgumentException("No config found : " + prefixKey);
        }
        return instantiate(config.getConfig(prefixKey), type);
    }

    /**
     * Instantiates the class named by {@code class} in {@code innerConfig}.
     */
    public static <T> T instantiate(Config innerConfig, Class<T> type) throws Exception {
        var clazz = innerConfig.getString(CLASS_KEY);
        var c = Class.forName(clazz);
        if (!type.isAssignableFrom(c)) {
            throw new IllegalArgumentException(clazz + " is not a " + type.getName());
        }
        Object object;
        try {
            var constructorWithConfig = c.getConstructor(constructorParameterTypes);
            object = constructorWithConfig.newInstance(innerConfig);
        } catch (NoSuchMethodException e) {
            object = c.getConstructor().newInstance();
        }
        return type.cast(object);
    }
}
