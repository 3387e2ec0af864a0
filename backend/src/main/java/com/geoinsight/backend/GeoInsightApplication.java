package com.geoinsight.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GeoInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoInsightApplication.class, args);
    }
}
