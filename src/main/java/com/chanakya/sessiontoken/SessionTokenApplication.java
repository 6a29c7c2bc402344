package com.chanakya.sessiontoken;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SessionTokenApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionTokenApplication.class, args);
    }

}
