package com.astroinsight.astroinsight_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AstroInsightBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstroInsightBackendApplication.class, args);
    }
}
