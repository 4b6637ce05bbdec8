package com.callstt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CallSttApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallSttApplication.class, args);
    }
}
