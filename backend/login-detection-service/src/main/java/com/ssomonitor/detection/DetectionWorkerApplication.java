package com.ssomonitor.detection;

import com.ssomonitor.detection.config.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * SSO Monitor login page detection worker.
 *
 * - {@code worker.role=consumer}: consumes analysis tasks from Kafka and reports results
 * - {@code worker.role=analysis}: child process that runs a single analysis and exits
 * - optional crawl backend socket servers for the external crawler
 */
@SpringBootApplication
public class DetectionWorkerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DetectionWorkerApplication.class, args);
        String role = context.getEnvironment().getProperty("worker.role", WorkerProperties.ROLE_CONSUMER);
        if (WorkerProperties.ROLE_ANALYSIS.equals(role)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
