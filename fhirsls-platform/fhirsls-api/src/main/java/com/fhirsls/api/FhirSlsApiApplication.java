package com.fhirsls.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FHIR Security Labeling Service API.
 *
 * Compiles sensitive-topic ValueSets into labeling rules and tags clinical record bundles.
 */
@SpringBootApplication
public class FhirSlsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FhirSlsApiApplication.class, args);
    }
}
