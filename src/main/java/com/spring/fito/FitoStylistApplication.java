package com.spring.fito;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class FitoStylistApplication {

    public static void main(String[] args) {
        SpringApplication.run(FitoStylistApplication.class, args);
    }
}
