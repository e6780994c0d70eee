package com.driftwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftWatchApplication.class, args);
    }
}
