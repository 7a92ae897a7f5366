package io.bdrc.catalogsync.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from environment variables.  Every name of a {@link Parameter}
 * is turned into an UPPER_SNAKE_CASE variable (for example {@code --opensearch-host} and
 * {@code --opensearchHost} both map to {@code OPENSEARCH_HOST}), optionally prefixed.  The first
 * name with a value set in the environment wins.
 * <p>
 * Injection is meant to run before command-line parsing so that explicit flags override the environment.
 */
@Slf4j
public class EnvVarParameterPuller {

    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params) {
        return injectFromEnv(params, System::getenv, "");
    }

    public static <T> T injectFromEnv(T params, String prefix) {
        return injectFromEnv(params, System::getenv, prefix);
    }

    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, prefix, addedEnvParams);
        if (!addedEnvParams.isEmpty()) {
            log.atInfo().setMessage("Adding parameters from the following environment variables: {}")
                .addArgument(addedEnvParams).log();
        }
        return params;
    }

    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               String prefix,
                                               List<String> addedEnvParams) {
        for (Class<?> clazz = params.getClass(); clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
            for (Field field : clazz.getDeclaredFields()) {
                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        field.setAccessible(true);
                        var delegate = field.get(params);
                        if (delegate != null) {
                            injectFromEnvRecursive(delegate, envVarGetter, prefix, addedEnvParams);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        var annotation = field.getAnnotation(Parameter.class);
                        var found = findEnvValue(annotation, envVarGetter, prefix);
                        if (found.isPresent()) {
                            field.setAccessible(true);
                            if (setFieldValue(params, field, found.get().getValue())) {
                                addedEnvParams.add(found.get().getKey());
                            }
                        }
                    }
                } catch (IllegalAccessException e) {
                    log.atWarn().setCause(e).setMessage("Could not access field: {}").addArgument(field.getName()).log();
                }
            }
        }
    }

    private static Optional<Map.Entry<String, String>> findEnvValue(Parameter annotation,
                                                                    EnvVarGetter envVarGetter,
                                                                    String prefix) {
        for (String name : annotation.names()) {
            var envName = toEnvVarName(name, prefix);
            var envValue = envVarGetter.getEnv(envName);
            if (envValue != null) {
                return Optional.of(Map.entry(envName, envValue));
            }
        }
        return Optional.empty();
    }

    /**
     * {@code --data-dir} becomes {@code DATA_DIR}, {@code --dataDir} becomes {@code DATA_DIR}.
     */
    public static String toEnvVarName(String argName, String prefix) {
        var normalized = argName.replaceAll("^-+", "")
            .replace("-", "_")
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return prefix + normalized.toUpperCase();
    }

    private static boolean setFieldValue(Object params, Field field, String value) throws IllegalAccessException {
        Class<?> type = field.getType();
        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value.trim()));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value.trim()));
            } else if (type == double.class || type == Double.class) {
                field.set(params, Double.parseDouble(value.trim()));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value.trim()));
            } else {
                log.atWarn().setMessage("Unsupported field type for environment variable injection: {} (field: {})")
                    .addArgument(type::getName)
                    .addArgument(field::getName)
                    .log();
                return false;
            }
            return true;
        } catch (NumberFormatException e) {
            log.atError().setCause(e)
                .setMessage("Failed to parse environment variable value '{}' for field '{}' of type {}")
                .addArgument(value)
                .addArgument(field::getName)
                .addArgument(type::getName)
                .log();
            return false;
        }
    }
}
