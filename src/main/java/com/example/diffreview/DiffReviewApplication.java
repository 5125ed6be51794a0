package com.example.diffreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiffReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiffReviewApplication.class, args);
    }
}
