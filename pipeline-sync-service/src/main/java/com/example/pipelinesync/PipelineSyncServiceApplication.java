package com.example.pipelinesync;

import com.example.pipelinesync.cli.OneShotCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Map;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class PipelineSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(PipelineSyncServiceApplication.class);
        if (!OneShotCommand.isOneShot(args)) {
            application.run(args);
            return;
        }

        // One-shot: no server, no schedules, exit with the run's status.
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setDefaultProperties(Map.of("sync.scheduler.enabled", "false"));
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}
