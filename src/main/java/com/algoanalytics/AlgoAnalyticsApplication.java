package com.algoanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlgoAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlgoAnalyticsApplication.class, args);
    }
}
