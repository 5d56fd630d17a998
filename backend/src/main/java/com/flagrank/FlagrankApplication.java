package com.flagrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FlagrankApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlagrankApplication.class, args);
    }
}
