package com.capgains;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CapGainsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapGainsApplication.class, args);
    }
}
