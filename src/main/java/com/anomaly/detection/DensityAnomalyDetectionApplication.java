package com.anomaly.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DensityAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(DensityAnomalyDetectionApplication.class, args);
    }
}
