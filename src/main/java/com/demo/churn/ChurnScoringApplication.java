package com.demo.churn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@EnableRetry
@SpringBootApplication
public class ChurnScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChurnScoringApplication.class, args);
    }
}
