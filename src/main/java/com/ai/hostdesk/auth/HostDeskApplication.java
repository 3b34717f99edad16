package com.ai.hostdesk.auth;

import com.ai.hostdesk.config.HostDeskProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.ai.hostdesk")
@EnableJpaRepositories(basePackages = "com.ai.hostdesk.repository")
@EntityScan(basePackages = "com.ai.hostdesk.entity")
@EnableConfigurationProperties(HostDeskProperties.class)
@EnableScheduling
public class HostDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostDeskApplication.class, args);
    }
}
