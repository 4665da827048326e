package com.datakeeper.policy;

import com.datakeeper.config.DownsamplingMethod;
import com.datakeeper.store.StateStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Context of one policy evaluation or application.
 * Immutable after creation; a policy derives the effective context of a call by
 * overlaying the caller's values on its own defaults (see {@link #overlay(PolicyContext)}).
 * <p>
 * Unset values fall back as follows: collections are empty, optional values are empty,
 * {@code recursive} and {@code preserveOriginal} are true, {@code dryRun} is false.
 */
public final class PolicyContext {

    private final String executionId;
    private final String policyId;
    private final String policyName;
    private final boolean scheduled;
    private final Instant triggerTime;
    private final StateStore stateStore;
    private final List<String> dataTypes;
    private final List<String> tags;
    private final List<String> filePaths;
    private final Map<String, Object> metadata;
    private final Long retentionTime;
    private final Long warningTime;
    private final String timeUnit;
    private final List<DownsamplingMethod> methods;
    private final Boolean preserveOriginal;
    private final Boolean recursive;
    private final Boolean dryRun;
    private final Map<String, Object> attributes;

    private PolicyContext(Builder builder) {
        this.executionId = builder.executionId != null ? builder.executionId : UUID.randomUUID().toString();
        this.policyId = builder.policyId;
        this.policyName = builder.policyName;
        this.scheduled = builder.scheduled;
        this.triggerTime = builder.triggerTime;
        this.stateStore = builder.stateStore;
        this.dataTypes = List.copyOf(builder.dataTypes);
        this.tags = List.copyOf(builder.tags);
        this.filePaths = List.copyOf(builder.filePaths);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.retentionTime = builder.retentionTime;
        this.warningTime = builder.warningTime;
        this.timeUnit = builder.timeUnit;
        this.methods = List.copyOf(builder.methods);
        this.preserveOriginal = builder.preserveOriginal;
        this.recursive = builder.recursive;
        this.dryRun = builder.dryRun;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Empty context, as used by callers that only want the policy defaults.
     */
    public static PolicyContext empty() {
        return builder().build();
    }

    /**
     * Unique id of this execution, generated when not supplied.
     */
    public String getExecutionId() {
        return executionId;
    }

    public Optional<String> getPolicyId() {
        return Optional.ofNullable(policyId);
    }

    public Optional<String> getPolicyName() {
        return Optional.ofNullable(policyName);
    }

    /**
     * Whether this context was created by the scheduler.
     */
    public boolean isScheduled() {
        return scheduled;
    }

    public Optional<Instant> getTriggerTime() {
        return Optional.ofNullable(triggerTime);
    }

    /**
     * State store operations report their status to, when present.
     */
    public Optional<StateStore> getStateStore() {
        return Optional.ofNullable(stateStore);
    }

    public List<String> getDataTypes() {
        return dataTypes;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getFilePaths() {
        return filePaths;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Optional<Long> getRetentionTime() {
        return Optional.ofNullable(retentionTime);
    }

    public Optional<Long> getWarningTime() {
        return Optional.ofNullable(warningTime);
    }

    public Optional<String> getTimeUnit() {
        return Optional.ofNullable(timeUnit);
    }

    public List<DownsamplingMethod> getMethods() {
        return methods;
    }

    public boolean isPreserveOriginal() {
        return preserveOriginal == null || preserveOriginal;
    }

    public boolean isRecursive() {
        return recursive == null || recursive;
    }

    public boolean isDryRun() {
        return dryRun != null && dryRun;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Create a new context holding this context's values, replaced by every value
     * explicitly set on {@code overrides}. Empty collections on {@code overrides} count
     * as unset, and metadata and attributes are merged key by key.
     */
    public PolicyContext overlay(PolicyContext overrides) {
        if (overrides == null) {
            return this;
        }
        Builder builder = toBuilder();
        builder.executionId(overrides.executionId);
        if (overrides.policyId != null) builder.policyId(overrides.policyId);
        if (overrides.policyName != null) builder.policyName(overrides.policyName);
        builder.scheduled(scheduled || overrides.scheduled);
        if (overrides.triggerTime != null) builder.triggerTime(overrides.triggerTime);
        if (overrides.stateStore != null) builder.stateStore(overrides.stateStore);
        if (!overrides.dataTypes.isEmpty()) builder.dataTypes(overrides.dataTypes);
        if (!overrides.tags.isEmpty()) builder.tags(overrides.tags);
        if (!overrides.filePaths.isEmpty()) builder.filePaths(overrides.filePaths);
        builder.metadata(overrides.metadata);
        if (overrides.retentionTime != null) builder.retentionTime(overrides.retentionTime);
        if (overrides.warningTime != null) builder.warningTime(overrides.warningTime);
        if (overrides.timeUnit != null) builder.timeUnit(overrides.timeUnit);
        if (!overrides.methods.isEmpty()) builder.methods(overrides.methods);
        if (overrides.preserveOriginal != null) builder.preserveOriginal(overrides.preserveOriginal);
        if (overrides.recursive != null) builder.recursive(overrides.recursive);
        if (overrides.dryRun != null) builder.dryRun(overrides.dryRun);
        builder.attributes(overrides.attributes);
        return builder.build();
    }

    /**
     * Builder initialized with this context's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.executionId = executionId;
        builder.policyId = policyId;
        builder.policyName = policyName;
        builder.scheduled = scheduled;
        builder.triggerTime = triggerTime;
        builder.stateStore = stateStore;
        builder.dataTypes = new ArrayList<>(dataTypes);
        builder.tags = new ArrayList<>(tags);
        builder.filePaths = new ArrayList<>(filePaths);
        builder.metadata.putAll(metadata);
        builder.retentionTime = retentionTime;
        builder.warningTime = warningTime;
        builder.timeUnit = timeUnit;
        builder.methods = new ArrayList<>(methods);
        builder.preserveOriginal = preserveOriginal;
        builder.recursive = recursive;
        builder.dryRun = dryRun;
        builder.attributes.putAll(attributes);
        return builder;
    }

    @Override
    public String toString() {
        return "PolicyContext{" +
                "executionId='" + executionId + '\'' +
                ", policyId='" + policyId + '\'' +
                ", scheduled=" + scheduled +
                ", dataTypes=" + dataTypes +
                ", tags=" + tags +
                ", filePaths=" + filePaths +
                ", retentionTime=" + retentionTime +
                ", timeUnit='" + timeUnit + '\'' +
                ", metadata=" + metadata +
                '}';
    }

    /**
     * Builder for PolicyContext.
     */
    public static class Builder {
        private String executionId;
        private String policyId;
        private String policyName;
        private boolean scheduled;
        private Instant triggerTime;
        private StateStore stateStore;
        private List<String> dataTypes = new ArrayList<>();
        private List<String> tags = new ArrayList<>();
        private List<String> filePaths = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Long retentionTime;
        private Long warningTime;
        private String timeUnit;
        private List<DownsamplingMethod> methods = new ArrayList<>();
        private Boolean preserveOriginal;
        private Boolean recursive;
        private Boolean dryRun;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder policyId(String policyId) {
            this.policyId = policyId;
            return this;
        }

        public Builder policyName(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder scheduled(boolean scheduled) {
            this.scheduled = scheduled;
            return this;
        }

        public Builder triggerTime(Instant triggerTime) {
            this.triggerTime = triggerTime;
            return this;
        }

        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public Builder dataTypes(List<String> dataTypes) {
            this.dataTypes = dataTypes != null ? new ArrayList<>(dataTypes) : new ArrayList<>();
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
            return this;
        }

        public Builder filePaths(List<String> filePaths) {
            this.filePaths = filePaths != null ? new ArrayList<>(filePaths) : new ArrayList<>();
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            if (metadata != null) {
                metadata.forEach(this::metadata);
            }
            return this;
        }

        public Builder retentionTime(Long retentionTime) {
            this.retentionTime = retentionTime;
            return this;
        }

        public Builder warningTime(Long warningTime) {
            this.warningTime = warningTime;
            return this;
        }

        public Builder timeUnit(String timeUnit) {
            this.timeUnit = timeUnit;
            return this;
        }

        public Builder methods(List<DownsamplingMethod> methods) {
            this.methods = methods != null ? new ArrayList<>(methods) : new ArrayList<>();
            return this;
        }

        public Builder preserveOriginal(Boolean preserveOriginal) {
            this.preserveOriginal = preserveOriginal;
            return this;
        }

        public Builder recursive(Boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder dryRun(Boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (name != null && value != null) {
                this.attributes.put(name, value);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public PolicyContext build() {
            return new PolicyContext(this);
        }
    }
}
