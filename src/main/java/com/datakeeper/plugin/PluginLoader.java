package com.datakeeper.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Runs the registration of built-in and external plugin modules.
 * A module that fails to load or register is logged and skipped.
 */
class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private final PluginRegistry registry;

    PluginLoader(PluginRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return Number of modules registered
     */
    int load(Path directory) {
        int loaded = 0;
        for (PluginModule module : BuiltinPlugins.modules()) {
            if (register(module, "built-in")) {
                loaded++;
            }
        }
        if (directory == null) {
            return loaded;
        }
        if (!Files.isDirectory(directory)) {
            log.warn("Plugin directory {} does not exist, only built-in plugins are available", directory);
            return loaded;
        }

        for (Path jar : listJars(directory)) {
            loaded += loadJar(jar);
        }
        return loaded;
    }

    private List<Path> listJars(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list plugin directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private int loadJar(Path jar) {
        URLClassLoader classLoader;
        try {
            classLoader = new URLClassLoader(new URL[]{jar.toUri().toURL()},
                    PluginRegistry.class.getClassLoader());
        } catch (MalformedURLException e) {
            log.error("Invalid plugin jar path {}: {}", jar, e.getMessage());
            return 0;
        }

        int loaded = 0;
        Iterator<PluginModule> providers = ServiceLoader.load(PluginModule.class, classLoader).iterator();
        while (true) {
            PluginModule module;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                module = providers.next();
            } catch (ServiceConfigurationError e) {
                log.error("Failed to load plugin module from {}: {}", jar, e.getMessage());
                continue;
            }
            // providers visible through the parent loader are not part of this jar
            if (module.getClass().getClassLoader() != classLoader) {
                continue;
            }
            if (register(module, jar.getFileName().toString())) {
                loaded++;
            }
        }
        if (loaded == 0) {
            log.warn("Plugin jar {} declares no usable plugin module", jar);
        }
        return loaded;
    }

    private boolean register(PluginModule module, String origin) {
        try {
            module.register(registry);
            log.debug("Registered plugin module {} ({})", module.getClass().getName(), origin);
            return true;
        } catch (RuntimeException | LinkageError e) {
            log.error("Plugin module {} ({}) failed to register: {}",
                    module.getClass().getName(), origin, e.toString());
            return false;
        }
    }
}
