package com.datakeeper;

import com.datakeeper.policy.PolicyStore;
import com.datakeeper.scheduler.JobScheduler;
import com.datakeeper.spring.EnableDataKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * DataKeeper service: runs the configured policies until the process is stopped.
 */
@SpringBootApplication
@EnableDataKeeper
public class DataKeeperApplication {

    private static final Logger log = LoggerFactory.getLogger(DataKeeperApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(DataKeeperApplication.class);
        application.setRegisterShutdownHook(true);
        application.run(args);
    }

    @Bean
    public CommandLineRunner status(PolicyStore policyStore, JobScheduler jobScheduler) {
        return args -> {
            log.info("=== DataKeeper Started ===");
            log.info("Policies loaded from {}: {}", policyStore.getPolicyPath(),
                    policyStore.getPolicies().stream().map(p -> p.getName() + " (" + p.getKind() + ")").toList());
            for (String jobId : jobScheduler.getScheduledJobIds()) {
                log.info("Job {} next run: {}", jobId, jobScheduler.getNextFireTime(jobId).orElse(null));
            }
        };
    }
}
