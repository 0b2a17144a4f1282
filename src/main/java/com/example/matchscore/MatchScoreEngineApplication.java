package com.example.matchscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchScoreEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchScoreEngineApplication.class, args);
    }

}
