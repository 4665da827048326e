package com.datakeeper.adapter.spring;

import com.datakeeper.config.ConfigLoader;
import com.datakeeper.operation.downsampling.TempFileReconciler;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.policy.Policy;
import com.datakeeper.policy.PolicyStore;
import com.datakeeper.scheduler.JobScheduler;
import com.datakeeper.scheduler.PolicyFileMonitor;
import com.datakeeper.store.StateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spring Boot auto-configuration for DataKeeper.
 * <p>
 * Loads plugins and policies, reconciles leftover temporary files, then starts the job
 * scheduler and the policy file monitor.
 */
@Configuration
@ConditionalOnProperty(prefix = "datakeeper", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DataKeeperProperties.class)
public class DataKeeperAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DataKeeperAutoConfiguration.class);

    private JobScheduler jobScheduler;
    private PolicyFileMonitor policyFileMonitor;
    private StateStore stateStore;
    private boolean purgeOnShutdown;

    @Bean
    @ConditionalOnMissingBean
    public PluginRegistry pluginRegistry(DataKeeperProperties properties) {
        PluginRegistry registry = new PluginRegistry();
        String pluginDir = properties.getPluginDir();
        registry.loadPlugins(pluginDir != null && !pluginDir.isBlank() ? Path.of(pluginDir) : null);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public StateStore stateStore(DataKeeperProperties properties) {
        log.info("Opening state store at: {}", properties.getDbPath());
        this.stateStore = StateStore.sqlite(Path.of(properties.getDbPath()),
                ConfigLoader.getResource(properties.getSchemaPath()));
        this.purgeOnShutdown = properties.isPurgeOnShutdown();
        return this.stateStore;
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyStore policyStore(DataKeeperProperties properties, StateStore stateStore, PluginRegistry registry) {
        log.info("Loading policies from: {}", properties.getPolicyPath());
        PolicyStore policyStore = new PolicyStore(properties.getPolicyPath(), stateStore, registry);
        policyStore.load();
        return policyStore;
    }

    @Bean(name = "dataKeeperTaskScheduler")
    @ConditionalOnMissingBean(name = "dataKeeperTaskScheduler")
    public ThreadPoolTaskScheduler dataKeeperTaskScheduler(DataKeeperProperties properties) {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(Math.max(1, properties.getScheduler().getPoolSize()));
        taskScheduler.setThreadNamePrefix("datakeeper-job-");
        // shutdown() rather than shutdownNow(): a running job is never interrupted
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled task: {}", t.getMessage(), t));
        taskScheduler.initialize();
        return taskScheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(DataKeeperProperties properties, PolicyStore policyStore, StateStore stateStore,
                                     @Qualifier("dataKeeperTaskScheduler") ThreadPoolTaskScheduler taskScheduler) {
        if (properties.isReconcileOnStartup()) {
            reconcileTempFiles(policyStore.getPolicies());
        }
        this.jobScheduler = new JobScheduler(policyStore, stateStore, taskScheduler, Clock.systemDefaultZone(),
                Duration.ofSeconds(properties.getScheduler().getMisfireGraceSeconds()));
        jobScheduler.setupJobs();
        jobScheduler.start();
        return this.jobScheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyFileMonitor policyFileMonitor(DataKeeperProperties properties, PolicyStore policyStore,
                                               JobScheduler jobScheduler,
                                               @Qualifier("dataKeeperTaskScheduler") ThreadPoolTaskScheduler taskScheduler) {
        this.policyFileMonitor = new PolicyFileMonitor(policyStore, jobScheduler,
                Duration.ofSeconds(properties.getPolicyCheckIntervalSeconds()));
        policyFileMonitor.start(taskScheduler);
        return this.policyFileMonitor;
    }

    private static void reconcileTempFiles(List<Policy> policies) {
        Set<String> directories = new LinkedHashSet<>();
        Set<String> extensions = new LinkedHashSet<>();
        for (Policy policy : policies) {
            directories.addAll(policy.getSelector().paths());
            extensions.addAll(policy.getSelector().dataTypes());
        }
        if (directories.isEmpty()) {
            return;
        }
        TempFileReconciler.Report report = new TempFileReconciler()
                .reconcile(List.copyOf(directories), List.copyOf(extensions));
        log.info("Startup reconciliation: {} stray temp files deleted, {} restored, {} failed",
                report.deleted(), report.restored(), report.failed());
    }

    @PreDestroy
    public void shutdown() {
        if (policyFileMonitor != null) {
            policyFileMonitor.stop();
        }
        if (jobScheduler != null && !jobScheduler.isStopped()) {
            log.info("Shutting down JobScheduler");
            jobScheduler.shutdown();
        }
        if (stateStore != null && purgeOnShutdown) {
            log.info("Purging policies from state store");
            stateStore.removeAllPolicies();
        }
    }
}
