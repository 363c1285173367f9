package com.williamcallahan.scormingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScormIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScormIngestApplication.class, args);
    }

}
