package com.bitanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BitAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BitAnalyticsApplication.class, args);
    }
}
