package com.example.vibescore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VibeScoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(VibeScoreApplication.class, args);
    }
}
