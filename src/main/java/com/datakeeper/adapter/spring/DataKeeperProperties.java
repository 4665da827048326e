package com.datakeeper.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for DataKeeper.
 */
@ConfigurationProperties(prefix = "datakeeper")
public class DataKeeperProperties {

    /**
     * Whether DataKeeper is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the policy file.
     * Supports classpath: prefix for classpath resources.
     */
    private String policyPath = "classpath:policy.yaml";

    /**
     * SQLite database file of the state store.
     */
    private String dbPath = "data/datakeeper.db";

    /**
     * Schema script run when the state store starts. Supports classpath: prefix.
     */
    private String schemaPath = "classpath:db/schema.sql";

    /**
     * Directory scanned for plugin jars. Built-in plugins only when unset.
     */
    private String pluginDir;

    /**
     * Seconds between two checks of the policy file.
     */
    private long policyCheckIntervalSeconds = 300;

    /**
     * Remove every policy and job row at shutdown.
     */
    private boolean purgeOnShutdown = true;

    /**
     * Clean up temporary files left by interrupted downsampling runs before scheduling.
     */
    private boolean reconcileOnStartup = true;

    private final Scheduler scheduler = new Scheduler();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public void setPolicyPath(String policyPath) {
        this.policyPath = policyPath;
    }

    public String getDbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public String getSchemaPath() {
        return schemaPath;
    }

    public void setSchemaPath(String schemaPath) {
        this.schemaPath = schemaPath;
    }

    public String getPluginDir() {
        return pluginDir;
    }

    public void setPluginDir(String pluginDir) {
        this.pluginDir = pluginDir;
    }

    public long getPolicyCheckIntervalSeconds() {
        return policyCheckIntervalSeconds;
    }

    public void setPolicyCheckIntervalSeconds(long policyCheckIntervalSeconds) {
        this.policyCheckIntervalSeconds = policyCheckIntervalSeconds;
    }

    public boolean isPurgeOnShutdown() {
        return purgeOnShutdown;
    }

    public void setPurgeOnShutdown(boolean purgeOnShutdown) {
        this.purgeOnShutdown = purgeOnShutdown;
    }

    public boolean isReconcileOnStartup() {
        return reconcileOnStartup;
    }

    public void setReconcileOnStartup(boolean reconcileOnStartup) {
        this.reconcileOnStartup = reconcileOnStartup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Scheduler {

        /**
         * Worker threads running policy jobs.
         */
        private int poolSize = 4;

        /**
         * A run that starts later than this after its scheduled time is skipped.
         */
        private long misfireGraceSeconds = 60;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public long getMisfireGraceSeconds() {
            return misfireGraceSeconds;
        }

        public void setMisfireGraceSeconds(long misfireGraceSeconds) {
            this.misfireGraceSeconds = misfireGraceSeconds;
        }
    }
}
