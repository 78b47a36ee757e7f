package com.logo.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LogoPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogoPlaygroundApplication.class, args);
    }
}
