package com.narrateplus;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a config interface against layered properties.
 *
 * Lookup order, last wins: interface defaults, {@code narrateplus.properties} on the
 * classpath, an optional external file, then {@code narrateplus.*} system properties.
 */
@Slf4j
public final class ConfigLoader
{
    public static final String RESOURCE = "/narrateplus.properties";

    private ConfigLoader()
    {
    }

    public static NarratePlusConfig load()
    {
        return load(null);
    }

    public static NarratePlusConfig load(Path externalFile)
    {
        Properties props = new Properties();

        try (InputStream in = ConfigLoader.class.getResourceAsStream(RESOURCE))
        {
            if (in != null)
            {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        catch (IOException e)
        {
            log.warn("Failed to read {} from classpath", RESOURCE, e);
        }

        if (externalFile != null)
        {
            try (Reader r = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8))
            {
                props.load(r);
            }
            catch (IOException e)
            {
                throw new IllegalArgumentException("Cannot read config file " + externalFile, e);
            }
        }

        for (String name : System.getProperties().stringPropertyNames())
        {
            if (name.startsWith(NarratePlusConfig.GROUP + "."))
            {
                props.setProperty(name, System.getProperty(name));
            }
        }

        return fromProperties(props);
    }

    public static NarratePlusConfig fromProperties(Properties props)
    {
        return proxy(NarratePlusConfig.class, NarratePlusConfig.GROUP, props);
    }

    static <T> T proxy(Class<T> type, String group, Properties props)
    {
        final Properties snapshot = new Properties();
        snapshot.putAll(props);

        InvocationHandler handler = (proxy, method, args) ->
        {
            if (method.getDeclaringClass() == Object.class)
            {
                return objectMethod(proxy, method, args, type);
            }

            String raw = snapshot.getProperty(group + "." + method.getName());
            if (raw != null && !raw.trim().isEmpty())
            {
                try
                {
                    return convert(raw.trim(), method.getReturnType());
                }
                catch (IllegalArgumentException e)
                {
                    log.warn("Ignoring invalid value '{}' for {}.{}", raw, group, method.getName());
                }
            }

            if (method.isDefault())
            {
                return InvocationHandler.invokeDefault(proxy, method, args);
            }
            throw new IllegalStateException("No value for " + group + "." + method.getName());
        };

        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    static Object convert(String raw, Class<?> target)
    {
        if (target == String.class)
        {
            return raw;
        }
        if (target == int.class || target == Integer.class)
        {
            return Integer.parseInt(raw);
        }
        if (target == long.class || target == Long.class)
        {
            return Long.parseLong(raw.replace("_", ""));
        }
        if (target == double.class || target == Double.class)
        {
            return Double.parseDouble(raw);
        }
        if (target == float.class || target == Float.class)
        {
            return Float.parseFloat(raw);
        }
        if (target == boolean.class || target == Boolean.class)
        {
            if (!"true".equalsIgnoreCase(raw) && !"false".equalsIgnoreCase(raw))
            {
                throw new IllegalArgumentException("Not a boolean: " + raw);
            }
            return Boolean.parseBoolean(raw);
        }
        if (target.isEnum())
        {
            for (Object constant : target.getEnumConstants())
            {
                if (((Enum<?>) constant).name().equalsIgnoreCase(raw.trim()))
                {
                    return constant;
                }
            }
            throw new IllegalArgumentException("Not a " + target.getSimpleName() + ": " + raw);
        }
        throw new IllegalArgumentException("Unsupported config type " + target.getName());
    }

    private static Object objectMethod(Object proxy, Method method, Object[] args, Class<?> type)
    {
        switch (method.getName())
        {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return type.getSimpleName() + "Proxy";
            default:
                throw new UnsupportedOperationException(method.getName());
        }
    }
}
