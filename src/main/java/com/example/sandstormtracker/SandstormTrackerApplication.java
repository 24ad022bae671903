package com.example.sandstormtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SandstormTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SandstormTrackerApplication.class, args);
    }
}
