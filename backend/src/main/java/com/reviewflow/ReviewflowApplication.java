package com.reviewflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReviewflowApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReviewflowApplication.class, args);
    }
}
