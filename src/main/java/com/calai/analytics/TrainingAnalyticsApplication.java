package com.calai.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrainingAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainingAnalyticsApplication.class, args);
    }
}
