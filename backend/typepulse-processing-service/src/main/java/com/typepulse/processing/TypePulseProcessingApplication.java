package com.typepulse.processing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.typepulse")
public class TypePulseProcessingApplication {
    public static void main(String[] args) {
        SpringApplication.run(TypePulseProcessingApplication.class, args);
    }
}
