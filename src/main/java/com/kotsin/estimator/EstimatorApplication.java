package com.kotsin.estimator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application hosting the per-key estimator streams.
 */
@SpringBootApplication
public class EstimatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstimatorApplication.class, args);
    }
}
