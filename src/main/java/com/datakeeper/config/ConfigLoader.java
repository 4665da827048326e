package com.datakeeper.config;

import com.datakeeper.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads policy definitions from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load a policy file from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the policy file
     * @return Loaded policy file
     * @throws ConfigurationException if the file cannot be read or is not a YAML mapping
     */
    public static PolicyFileConfig load(String path) {
        log.info("Loading policies from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(path, inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load policies from: " + path, e);
        }
    }

    /**
     * Resolve a path to a Spring resource ("classpath:" prefix or filesystem path).
     */
    public static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PolicyFileConfig parseYaml(String source, InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Policy file is not valid YAML: " + source, e);
        }

        if (loaded == null) {
            log.warn("Policy file {} is empty", source);
            return new PolicyFileConfig(source, Map.of(), List.of(), List.of(), List.of());
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Policy file root must be a mapping: " + source);
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        Map<String, Object> settings = root.get("settings") instanceof Map<?, ?> s
                ? (Map<String, Object>) s
                : Map.of();
        List<Map<String, Object>> templates = root.get("policy_templates") instanceof List<?> t
                ? (List<Map<String, Object>>) t
                : List.of();

        List<PolicyDefinition> policies = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Object policiesObj = root.get("policies");
        List<Object> entries = policiesObj instanceof List<?> l ? (List<Object>) l : List.of();
        log.info("Found {} policies in {}", entries.size(), source);

        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            String label = "policies[" + i + "]";
            try {
                if (!(entry instanceof Map)) {
                    throw new ConfigurationException("Policy entry must be a mapping");
                }
                Map<String, Object> policyMap = (Map<String, Object>) entry;
                label = getString(policyMap, "name", label);
                policies.add(parsePolicy(policyMap));
            } catch (ConfigurationException | ClassCastException | IllegalArgumentException e) {
                log.warn("Skipping policy '{}': {}", label, e.getMessage());
                skipped.add(label);
            }
        }

        log.info("Loaded {} policies from {} ({} skipped)", policies.size(), source, skipped.size());
        return new PolicyFileConfig(source, settings, templates, policies, skipped);
    }

    @SuppressWarnings("unchecked")
    static PolicyDefinition parsePolicy(Map<String, Object> map) {
        String name = getString(map, "name", null);
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Policy has no name");
        }
        String description = getString(map, "description", "");
        boolean enabled = getBoolean(map, "enabled", true);

        List<TriggerDefinition> triggers = new ArrayList<>();
        for (Map<String, Object> triggerMap : getMapList(map, "triggers")) {
            String type = getString(triggerMap, "type", null);
            if (type == null) {
                throw new ConfigurationException("Policy '" + name + "' has a trigger without a type");
            }
            Map<String, Object> spec = triggerMap.get("spec") instanceof Map<?, ?> s
                    ? (Map<String, Object>) s
                    : Map.of();
            triggers.add(new TriggerDefinition(type, spec));
        }

        Map<String, Object> selectorMap = map.get("selector") instanceof Map<?, ?> s
                ? (Map<String, Object>) s
                : Map.of();
        SelectorDefinition selector = new SelectorDefinition(
                getStringList(selectorMap, "data_type"),
                getStringList(selectorMap, "tags"),
                getStringList(selectorMap, "paths"));

        List<ActionDefinition> actions = new ArrayList<>();
        for (Map<String, Object> actionMap : getMapList(map, "actions")) {
            String type = getString(actionMap, "type", null);
            if (type == null) {
                throw new ConfigurationException("Policy '" + name + "' has an action without a type");
            }
            Map<String, Object> specMap = actionMap.get("spec") instanceof Map<?, ?> s
                    ? (Map<String, Object>) s
                    : Map.of();
            actions.add(new ActionDefinition(type, parseActionSpec(specMap)));
        }

        if (actions.isEmpty()) {
            throw new ConfigurationException("Policy '" + name + "' has no actions");
        }
        if (actions.get(0).spec().operations().isEmpty()) {
            throw new ConfigurationException("Policy '" + name + "' has no operations");
        }

        log.debug("Parsed policy: name={}, enabled={}, triggers={}, kind={}",
                name, enabled, triggers.size(), actions.get(0).type());
        return new PolicyDefinition(name, description, enabled, triggers, selector, actions);
    }

    static ActionSpec parseActionSpec(Map<String, Object> map) {
        List<ExceptionRule> exceptions = new ArrayList<>();
        for (Map<String, Object> exceptionMap : getMapList(map, "exceptions")) {
            Object retention = exceptionMap.get("retention_time");
            exceptions.add(new ExceptionRule(
                    getString(exceptionMap, "condition", ""),
                    retention != null ? toLong(retention) : null));
        }

        List<DownsamplingMethod> methods = new ArrayList<>();
        for (Map<String, Object> methodMap : getMapList(map, "methods")) {
            methods.add(new DownsamplingMethod(
                    getString(methodMap, "dimension", DownsamplingMethod.TEMPORAL),
                    getString(methodMap, "algorithm", "mean"),
                    getInt(methodMap, "factor", 1),
                    getStringList(methodMap, "dataset"),
                    getString(methodMap, "apply_to_channels", null)));
        }

        return new ActionSpec(
                getString(map, "strategy", null),
                getStringList(map, "operations"),
                getLong(map, "retention_time", ActionSpec.DEFAULT_RETENTION_TIME),
                getLong(map, "warning_time", ActionSpec.DEFAULT_WARNING_TIME),
                getString(map, "time_unit", null),
                exceptions,
                methods,
                getBoolean(map, "preserve_original", true));
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return toLong(value);
    }

    private static long toLong(Object value) {
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    /**
     * Read a list of strings; a single scalar is accepted as a one-element list.
     */
    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return List.of(value.toString());
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("'" + key + "' entries must be mappings");
            }
            result.add(new LinkedHashMap<>((Map<String, Object>) item));
        }
        return result;
    }
}
