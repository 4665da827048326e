package com.datakeeper.plugin;

/**
 * Registration entry point of a plugin module.
 * <p>
 * Built-in modules are listed in {@link BuiltinPlugins}. External modules are packaged as
 * jars in the plugin directory and declared as {@code META-INF/services/com.datakeeper.plugin.PluginModule}
 * providers.
 */
@FunctionalInterface
public interface PluginModule {

    /**
     * Register this module's operations, strategies and policy kinds.
     */
    void register(PluginRegistry registry);
}
