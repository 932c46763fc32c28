package com.delta.jobprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobPrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobPrepApplication.class, args);
    }
}
