package com.datakeeper.plugin;

import com.datakeeper.policy.PolicyFactory;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Kinds of plugins held by the {@link PluginRegistry}.
 * Each kind derives registry names from implementation class names by stripping its suffix.
 * Operations and strategies are held as instance suppliers, policy kinds as {@link PolicyFactory}s.
 */
public enum PluginKind {

    OPERATION("Operation", Supplier.class),
    STRATEGY("Strategy", Supplier.class),
    POLICY("Policy", PolicyFactory.class);

    private final String suffix;
    private final Class<?> registeredType;

    PluginKind(String suffix, Class<?> registeredType) {
        this.suffix = suffix;
        this.registeredType = registeredType;
    }

    /**
     * Type every registered plugin of this kind must have.
     */
    public Class<?> getRegisteredType() {
        return registeredType;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Registry name for an implementation class: the simple name without this kind's
     * suffix, lowercased. {@code DataReductionOperation} becomes {@code datareduction}.
     */
    public String nameOf(Class<?> type) {
        String simpleName = type.getSimpleName();
        if (simpleName.endsWith(suffix) && simpleName.length() > suffix.length()) {
            simpleName = simpleName.substring(0, simpleName.length() - suffix.length());
        }
        return normalize(simpleName);
    }

    /**
     * Canonical form used for registration and lookup: lowercase, hyphens removed.
     * "data-reduction", "DataReduction" and "datareduction" all map to "datareduction".
     */
    public static String normalize(String name) {
        return name.replace("-", "").toLowerCase(Locale.ROOT).trim();
    }
}
