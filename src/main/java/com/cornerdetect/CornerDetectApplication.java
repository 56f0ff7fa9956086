package com.cornerdetect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CornerDetectApplication {

    public static void main(String[] args) {
        SpringApplication.run(CornerDetectApplication.class, args);
    }
}
