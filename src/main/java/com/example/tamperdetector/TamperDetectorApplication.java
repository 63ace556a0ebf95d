package com.example.tamperdetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TamperDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TamperDetectorApplication.class, args);
    }
}
