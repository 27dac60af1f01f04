package com.example.chronotrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChronoTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChronoTraceApplication.class, args);
    }
}
