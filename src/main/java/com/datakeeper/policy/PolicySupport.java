package com.datakeeper.policy;

import com.datakeeper.config.ActionSpec;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.operation.Operation;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.strategy.DefaultStrategy;
import com.datakeeper.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Behavior shared by the policy kinds: identity, selector matching and running the
 * configured operations through the configured strategy.
 */
final class PolicySupport {

    private static final Logger log = LoggerFactory.getLogger(PolicySupport.class);

    private final String id;
    private final PolicyDefinition definition;
    private final PluginRegistry registry;

    PolicySupport(String id, PolicyDefinition definition, PluginRegistry registry) {
        if (definition.actions().isEmpty() || definition.primaryAction().spec().operations().isEmpty()) {
            throw new ConfigurationException("Policy '" + definition.name() + "' has no operations");
        }
        this.id = id;
        this.definition = definition;
        this.registry = registry;
    }

    String id() {
        return id;
    }

    PolicyDefinition definition() {
        return definition;
    }

    ActionSpec spec() {
        return definition.primaryAction().spec();
    }

    /**
     * Context values every application of the policy starts from.
     */
    PolicyContext.Builder defaults() {
        SelectorDefinition selector = definition.selector();
        return PolicyContext.builder()
                .policyId(id)
                .policyName(definition.name())
                .dataTypes(selector.dataTypes())
                .tags(selector.tags())
                .filePaths(selector.paths());
    }

    /**
     * Check the effective context against the selector.
     * Every context data type must be allowed; with selector tags, at least one context tag must match.
     *
     * @return Reason for rejection, empty if the context matches
     */
    Optional<String> checkSelector(PolicyContext context) {
        SelectorDefinition selector = definition.selector();
        for (String dataType : context.getDataTypes()) {
            if (!selector.dataTypes().contains(dataType)) {
                return Optional.of("Data type '" + dataType + "' not in selector " + selector.dataTypes());
            }
        }
        if (selector.hasTags() && context.getTags().stream().noneMatch(selector.tags()::contains)) {
            return Optional.of("None of the tags " + context.getTags() + " in selector " + selector.tags());
        }
        return Optional.empty();
    }

    /**
     * Run the operations in declared order and return the result of the last one that ran.
     */
    Optional<OperationResult> runOperations(PolicyContext context) {
        Strategy strategy = registry.getStrategy(spec().strategy()).orElseGet(() -> {
            log.warn("Strategy '{}' not found for policy {}, using '{}'",
                    spec().strategy(), definition.name(), DefaultStrategy.NAME);
            return registry.getStrategy(DefaultStrategy.NAME).orElseGet(DefaultStrategy::new);
        });

        OperationResult last = null;
        for (String name : spec().operations()) {
            Optional<Operation> operation = registry.getOperation(name);
            if (operation.isEmpty()) {
                log.warn("Operation '{}' not found for policy {}, skipping", name, definition.name());
                continue;
            }
            last = strategy.apply(operation.get(), context);
            log.debug("Operation '{}' of policy {} finished: {}", name, definition.name(), last);
        }
        return Optional.ofNullable(last);
    }
}
