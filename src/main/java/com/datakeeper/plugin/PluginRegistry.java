package com.datakeeper.plugin;

import com.datakeeper.operation.Operation;
import com.datakeeper.policy.Policy;
import com.datakeeper.policy.PolicyFactory;
import com.datakeeper.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Name-keyed registry of operations, strategies and policy kinds.
 * <p>
 * Names are case-insensitive and ignore hyphens. Operations and strategies are registered
 * as factories so that every lookup returns a fresh instance. Lookups of unknown names
 * return empty and log a warning.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<PluginKind, Map<String, Object>> plugins = new EnumMap<>(PluginKind.class);
    private final AtomicBoolean pluginsLoaded = new AtomicBoolean(false);

    public PluginRegistry() {
        for (PluginKind kind : PluginKind.values()) {
            plugins.put(kind, new ConcurrentHashMap<>());
        }
    }

    /**
     * Registry holding the built-in plugins only.
     */
    public static PluginRegistry withBuiltins() {
        PluginRegistry registry = new PluginRegistry();
        registry.loadPlugins(null);
        return registry;
    }

    /**
     * Register a plugin under a name. A second registration under the same name replaces the first.
     *
     * @throws IllegalArgumentException if the plugin is not of the kind's registered type
     */
    public void register(PluginKind kind, String name, Object plugin) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(plugin, "plugin");
        if (!kind.getRegisteredType().isInstance(plugin)) {
            throw new IllegalArgumentException("A " + kind.name().toLowerCase() + " plugin must be a "
                    + kind.getRegisteredType().getSimpleName() + ", got " + plugin.getClass().getName());
        }

        String key = PluginKind.normalize(name);
        Object previous = plugins.get(kind).put(key, plugin);
        if (previous != null) {
            log.warn("Replaced {} plugin '{}'", kind.name().toLowerCase(), key);
        } else {
            log.debug("Registered {} plugin '{}'", kind.name().toLowerCase(), key);
        }
    }

    /**
     * Look up a plugin by name.
     *
     * @return The registered plugin, or empty (with a warning) if none matches
     */
    public Optional<Object> get(PluginKind kind, String name) {
        if (name == null || name.isBlank()) {
            log.warn("Lookup of {} plugin without a name", kind.name().toLowerCase());
            return Optional.empty();
        }
        Object plugin = plugins.get(kind).get(PluginKind.normalize(name));
        if (plugin == null) {
            log.warn("No {} plugin named '{}' (registered: {})",
                    kind.name().toLowerCase(), name, getNames(kind));
        }
        return Optional.ofNullable(plugin);
    }

    public boolean contains(PluginKind kind, String name) {
        return name != null && plugins.get(kind).containsKey(PluginKind.normalize(name));
    }

    /**
     * Registered names of a kind, sorted.
     */
    public Set<String> getNames(PluginKind kind) {
        return Collections.unmodifiableSet(new TreeSet<>(plugins.get(kind).keySet()));
    }

    public void registerOperation(Class<? extends Operation> type, Supplier<? extends Operation> factory) {
        register(PluginKind.OPERATION, PluginKind.OPERATION.nameOf(type), factory);
    }

    public void registerStrategy(Class<? extends Strategy> type, Supplier<? extends Strategy> factory) {
        register(PluginKind.STRATEGY, PluginKind.STRATEGY.nameOf(type), factory);
    }

    public void registerPolicyType(Class<? extends Policy> type, PolicyFactory factory) {
        register(PluginKind.POLICY, PluginKind.POLICY.nameOf(type), factory);
    }

    /**
     * Create a new instance of the named operation.
     *
     * @throws ClassCastException if the registered supplier does not produce an {@link Operation}
     */
    public Optional<Operation> getOperation(String name) {
        return create(PluginKind.OPERATION, name).map(Operation.class::cast);
    }

    /**
     * Create a new instance of the named strategy.
     *
     * @throws ClassCastException if the registered supplier does not produce a {@link Strategy}
     */
    public Optional<Strategy> getStrategy(String name) {
        return create(PluginKind.STRATEGY, name).map(Strategy.class::cast);
    }

    private Optional<Object> create(PluginKind kind, String name) {
        return get(kind, name).map(factory -> ((Supplier<?>) factory).get());
    }

    /**
     * Factory of the named policy kind.
     */
    public Optional<PolicyFactory> getPolicyType(String name) {
        return get(PluginKind.POLICY, name).map(PolicyFactory.class::cast);
    }

    /**
     * Register the built-in plugins and every plugin module found in {@code directory}.
     * Only the first call has an effect; later calls are ignored.
     *
     * @param directory Directory of plugin jars, or null for built-ins only
     * @return true if this call loaded the plugins
     */
    public boolean loadPlugins(Path directory) {
        if (!pluginsLoaded.compareAndSet(false, true)) {
            log.debug("Plugins already loaded, ignoring load from {}", directory);
            return false;
        }
        int loaded = new PluginLoader(this).load(directory);
        log.info("Loaded {} plugin modules: operations={}, strategies={}, policies={}",
                loaded, getNames(PluginKind.OPERATION), getNames(PluginKind.STRATEGY),
                getNames(PluginKind.POLICY));
        return true;
    }
}
