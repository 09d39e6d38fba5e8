package org.healthdata.mq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HealthDataQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthDataQueueApplication.class, args);
    }
}
