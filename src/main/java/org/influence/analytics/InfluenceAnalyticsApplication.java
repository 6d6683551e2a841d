package org.influence.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfluenceAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfluenceAnalyticsApplication.class, args);
    }
}
