package com.csd.leadscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadScoreApplication.class, args);
    }
}
