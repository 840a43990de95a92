package com.poisearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Points of interest server with HTTP JSON services over a refreshable spatial index
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PoiSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(PoiSearchApplication.class, args);
    }
}
