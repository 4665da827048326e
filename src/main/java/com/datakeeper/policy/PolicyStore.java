package com.datakeeper.policy;

import com.datakeeper.config.ConfigLoader;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.PolicyFileConfig;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.exception.PersistenceException;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.store.JobRow;
import com.datakeeper.store.PolicyRow;
import com.datakeeper.store.StateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads policy definitions, builds the policies through the plugin registry and records
 * each policy and its jobs in the state store.
 * <p>
 * Every enabled, valid entry yields one policy with a unique id (name plus a random token),
 * one policy row and one job row (status "added") per operation.
 */
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String policyPath;
    private final StateStore stateStore;
    private final PluginRegistry registry;

    private volatile List<Policy> policies = List.of();
    private volatile Map<String, Object> settings = Map.of();
    private volatile List<Map<String, Object>> templates = List.of();

    public PolicyStore(String policyPath, StateStore stateStore, PluginRegistry registry) {
        this.policyPath = policyPath;
        this.stateStore = stateStore;
        this.registry = registry;
    }

    /**
     * Load the policy file and instantiate its enabled policies, replacing the current set.
     * A missing file yields no policies; invalid entries are skipped.
     *
     * @return The loaded policies
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public synchronized List<Policy> load() {
        if (!ConfigLoader.getResource(policyPath).exists()) {
            log.warn("Policy file {} not found", policyPath);
            policies = List.of();
            return policies;
        }

        PolicyFileConfig config = ConfigLoader.load(policyPath);
        settings = config.settings();
        templates = config.templates();

        List<Policy> loaded = new ArrayList<>();
        for (PolicyDefinition definition : config.enabledPolicies()) {
            createPolicy(definition).ifPresent(loaded::add);
        }
        policies = List.copyOf(loaded);
        log.info("Loaded {} policies from {}: {}", policies.size(), policyPath,
                policies.stream().map(Policy::getName).toList());
        return policies;
    }

    /**
     * Remove the rows of the current policies and load the file again.
     */
    public synchronized List<Policy> reload() {
        log.info("Reloading policies from {}", policyPath);
        for (Policy policy : policies) {
            stateStore.deletePolicy(policy.getId());
        }
        return load();
    }

    /**
     * Build a policy from its definition and persist its policy and job rows.
     *
     * @return The policy, or empty if its kind is unknown, it is invalid, or it could not be persisted
     */
    public Optional<Policy> createPolicy(PolicyDefinition definition) {
        String kind = definition.actions().isEmpty() ? null : definition.primaryAction().type();
        Optional<PolicyFactory> factory = registry.getPolicyType(kind);
        if (factory.isEmpty()) {
            log.warn("Policy type '{}' not found, skipping policy '{}'", kind, definition.name());
            return Optional.empty();
        }

        String policyId = definition.name() + "-" + UUID.randomUUID();
        Policy policy;
        TriggerDefinition trigger;
        try {
            policy = factory.get().create(policyId, definition, registry);
            trigger = policy.getPrimaryTrigger().orElseThrow(() ->
                    new ConfigurationException("Policy '" + definition.name() + "' has no triggers"));
        } catch (ConfigurationException e) {
            log.warn("Skipping policy '{}': {}", definition.name(), e.getMessage());
            return Optional.empty();
        }

        try {
            persist(policy, trigger);
        } catch (PersistenceException e) {
            log.error("Cannot record policy '{}', skipping it: {}", definition.name(), e.getMessage(), e);
            stateStore.deletePolicy(policyId);
            return Optional.empty();
        }
        log.info("Created {} policy '{}' with id {}", policy.getKind(), policy.getName(), policyId);
        return Optional.of(policy);
    }

    private void persist(Policy policy, TriggerDefinition trigger) {
        SelectorDefinition selector = policy.getSelector();
        stateStore.addPolicy(PolicyRow.of(
                policy.getId(),
                policy.getName(),
                policyPath,
                policy.isEnabled(),
                policy.getStrategyName(),
                selector.dataTypes(),
                selector.tags(),
                selector.paths(),
                policy.getOperations(),
                policy.getTriggers().stream().map(TriggerDefinition::toMap).toList()));

        String filetypes = toJson(selector.paths());
        for (String operation : policy.getOperations()) {
            String descriptor = registry.getOperation(operation)
                    .map(op -> op.getClass().getName())
                    .orElse("unresolved");
            stateStore.addJob(JobRow.added(
                    operation + "-" + UUID.randomUUID(),
                    policy.getId(),
                    operation,
                    descriptor,
                    filetypes,
                    trigger.type(),
                    trigger.spec()));
        }
    }

    private static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize " + value, e);
        }
    }

    /**
     * Evaluate every enabled policy against the context and apply the accepted ones.
     * A policy that fails is logged and does not stop the others.
     *
     * @return Result of the last applied policy
     */
    public Optional<OperationResult> applyPolicies(PolicyContext context) {
        Optional<OperationResult> result = Optional.empty();
        for (Policy policy : policies) {
            if (!policy.isEnabled()) {
                continue;
            }
            try {
                EvaluationResult evaluation = policy.evaluate(context);
                if (!evaluation.isAccepted()) {
                    log.debug("Policy '{}' not applicable: {}", policy.getName(), evaluation.getExplanation());
                    continue;
                }
                log.info("Applying policy '{}': {}", policy.getName(), evaluation.getExplanation());
                result = policy.apply(context);
            } catch (RuntimeException e) {
                log.error("Error applying policy '{}': {}", policy.getName(), e.getMessage(), e);
            }
        }
        return result;
    }

    public Optional<Policy> getPolicyByName(String name) {
        return policies.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /**
     * Enabled policies with a trigger of the given type, each paired with its first such trigger.
     */
    public List<PolicyTrigger> getPoliciesByTriggerType(String triggerType) {
        List<PolicyTrigger> matching = new ArrayList<>();
        for (Policy policy : policies) {
            if (!policy.isEnabled()) {
                continue;
            }
            policy.getTriggers().stream()
                    .filter(t -> triggerType.equals(t.type()))
                    .findFirst()
                    .ifPresent(t -> matching.add(new PolicyTrigger(policy, t)));
        }
        return matching;
    }

    public List<PolicyTrigger> getScheduledPolicies() {
        return getPoliciesByTriggerType(TriggerDefinition.SCHEDULE);
    }

    public List<Policy> getPolicies() {
        return policies;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public List<Map<String, Object>> getTemplates() {
        return templates;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    /**
     * Policy file on the filesystem, empty for a classpath resource.
     */
    public Optional<Path> getPolicyFile() {
        try {
            return ConfigLoader.getResource(policyPath).isFile()
                    ? Optional.of(ConfigLoader.getResource(policyPath).getFile().toPath())
                    : Optional.empty();
        } catch (IOException e) {
            log.debug("Policy file {} is not on the filesystem: {}", policyPath, e.getMessage());
            return Optional.empty();
        }
    }
}
