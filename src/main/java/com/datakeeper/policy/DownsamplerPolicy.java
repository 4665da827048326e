package com.datakeeper.policy;

import com.datakeeper.config.DownsamplingMethod;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.operation.downsampling.ReductionMethod;
import com.datakeeper.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Policy that downsamples the datasets of matching files with its configured methods.
 */
public class DownsamplerPolicy implements Policy {

    private static final Logger log = LoggerFactory.getLogger(DownsamplerPolicy.class);

    public static final String KIND = "downsampler";

    private final PolicySupport support;

    public DownsamplerPolicy(String policyId, PolicyDefinition definition, PluginRegistry registry) {
        this.support = new PolicySupport(policyId, definition, registry);
        List<DownsamplingMethod> methods = support.spec().methods();
        if (methods.isEmpty()) {
            throw new ConfigurationException("Policy '" + definition.name() + "' has no downsampling methods");
        }
        for (DownsamplingMethod method : methods) {
            validate(definition.name(), method);
        }
    }

    private static void validate(String policyName, DownsamplingMethod method) {
        if (!method.isTemporal() && !method.isSpatial()) {
            throw new ConfigurationException("Policy '" + policyName + "': unknown dimension '"
                    + method.dimension() + "', expected temporal or spatial");
        }
        if (method.factor() < 1) {
            throw new ConfigurationException("Policy '" + policyName + "': factor must be at least 1, got "
                    + method.factor());
        }
        if (method.datasets().isEmpty()) {
            throw new ConfigurationException("Policy '" + policyName + "': method without datasets");
        }
        if (!"all".equalsIgnoreCase(method.applyToChannels())) {
            throw new ConfigurationException("Policy '" + policyName + "': apply_to_channels '"
                    + method.applyToChannels() + "' is not supported");
        }
        try {
            ReductionMethod.fromName(method.algorithm());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Policy '" + policyName + "': " + e.getMessage(), e);
        }
    }

    public static void register(PluginRegistry registry) {
        registry.registerPolicyType(DownsamplerPolicy.class, DownsamplerPolicy::new);
    }

    @Override
    public EvaluationResult evaluate(PolicyContext context) {
        PolicyContext effective = defaults().build().overlay(context);
        return support.checkSelector(effective)
                .map(DefaultEvaluationResult::rejected)
                .orElseGet(() -> DefaultEvaluationResult.accepted(null, null));
    }

    @Override
    public Optional<OperationResult> apply(PolicyContext context) {
        PolicyContext effective = defaults().build().overlay(context);
        log.info("Applying policy {} ({}): operations={}, methods={}", getName(), getId(),
                getOperations(), effective.getMethods().size());
        return support.runOperations(effective);
    }

    private PolicyContext.Builder defaults() {
        return support.defaults()
                .methods(support.spec().methods())
                .preserveOriginal(support.spec().preserveOriginal());
    }

    public List<DownsamplingMethod> getMethods() {
        return support.spec().methods();
    }

    @Override
    public String getId() {
        return support.id();
    }

    @Override
    public String getName() {
        return support.definition().name();
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public boolean isEnabled() {
        return support.definition().enabled();
    }

    @Override
    public List<TriggerDefinition> getTriggers() {
        return support.definition().triggers();
    }

    @Override
    public SelectorDefinition getSelector() {
        return support.definition().selector();
    }

    @Override
    public String getStrategyName() {
        return support.spec().strategy();
    }

    @Override
    public List<String> getOperations() {
        return support.spec().operations();
    }

    @Override
    public String toString() {
        return "DownsamplerPolicy{" +
                "id='" + getId() + '\'' +
                ", operations=" + getOperations() +
                ", methods=" + getMethods() +
                '}';
    }
}
