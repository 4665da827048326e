package com.datakeeper.policy;

import com.datakeeper.config.ActionSpec;
import com.datakeeper.config.ExceptionRule;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.operation.retention.RetentionUnit;
import com.datakeeper.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Policy that keeps files for a retention period, with ordered exceptions overriding the
 * period for contexts whose metadata matches.
 */
public class RetentionPolicy implements Policy {

    private static final Logger log = LoggerFactory.getLogger(RetentionPolicy.class);

    public static final String KIND = "retention";

    private record BoundException(ExceptionRule rule, ExceptionPredicate predicate) {
    }

    private final PolicySupport support;
    private final long retentionTime;
    private final long warningTime;
    private final RetentionUnit timeUnit;
    private final List<BoundException> exceptions;

    /**
     * Last accepted evaluation; its retention time is used by later {@link #apply} calls.
     * Single writer: the thread evaluating this policy. Callers never run one policy concurrently.
     */
    private volatile EvaluationResult lastEvaluation;

    public RetentionPolicy(String policyId, PolicyDefinition definition, PluginRegistry registry) {
        this.support = new PolicySupport(policyId, definition, registry);
        ActionSpec spec = support.spec();
        this.retentionTime = spec.retentionTime();
        this.warningTime = spec.warningTime();
        try {
            this.timeUnit = RetentionUnit.fromName(spec.timeUnit());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Policy '" + definition.name() + "': " + e.getMessage(), e);
        }

        List<BoundException> bound = new ArrayList<>();
        for (ExceptionRule rule : spec.exceptions()) {
            Optional<ExceptionPredicate> predicate = ExceptionPredicate.parse(rule.condition());
            if (predicate.isEmpty()) {
                log.warn("Policy '{}': unsupported exception condition '{}' never matches",
                        definition.name(), rule.condition());
            } else if (!predicate.get().isWholeCondition(rule.condition())) {
                log.warn("Policy '{}': exception condition '{}' is evaluated as {}",
                        definition.name(), rule.condition(), predicate.get());
            }
            bound.add(new BoundException(rule, predicate.orElse(null)));
        }
        this.exceptions = List.copyOf(bound);
    }

    public static void register(PluginRegistry registry) {
        registry.registerPolicyType(RetentionPolicy.class, RetentionPolicy::new);
    }

    @Override
    public EvaluationResult evaluate(PolicyContext context) {
        PolicyContext effective = defaults().build().overlay(context);

        Optional<String> rejection = support.checkSelector(effective);
        if (rejection.isPresent()) {
            log.debug("Policy {} rejects context {}: {}", getName(), effective.getExecutionId(), rejection.get());
            return DefaultEvaluationResult.rejected(rejection.get());
        }

        Map<String, Object> metadata = effective.getMetadata();
        EvaluationResult result = DefaultEvaluationResult.accepted(retentionTime, null);
        for (BoundException exception : exceptions) {
            if (exception.predicate() != null && exception.predicate().test(metadata)) {
                Long override = exception.rule().retentionTime();
                result = DefaultEvaluationResult.accepted(override != null ? override : retentionTime,
                        exception.rule());
                break;
            }
        }
        lastEvaluation = result;
        log.debug("Policy {} accepts context {}: {}", getName(), effective.getExecutionId(), result.getExplanation());
        return result;
    }

    @Override
    public Optional<OperationResult> apply(PolicyContext context) {
        PolicyContext.Builder defaults = defaults();
        EvaluationResult evaluation = lastEvaluation;
        if (evaluation != null) {
            evaluation.getEffectiveRetentionTime().ifPresent(defaults::retentionTime);
        }
        PolicyContext effective = defaults.build().overlay(context);
        log.info("Applying policy {} ({}): operations={}, retention={} {}", getName(), getId(),
                getOperations(), effective.getRetentionTime().orElse(null), effective.getTimeUnit().orElse(null));
        return support.runOperations(effective);
    }

    private PolicyContext.Builder defaults() {
        return support.defaults()
                .retentionTime(retentionTime)
                .warningTime(warningTime)
                .timeUnit(timeUnit.label());
    }

    public long getRetentionTime() {
        return retentionTime;
    }

    public long getWarningTime() {
        return warningTime;
    }

    public RetentionUnit getTimeUnit() {
        return timeUnit;
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
        return "RetentionPolicy{" +
                "id='" + getId() + '\'' +
                ", retention=" + retentionTime + " " + timeUnit.label() +
                ", operations=" + getOperations() +
                ", exceptions=" + exceptions.size() +
                '}';
    }
}
