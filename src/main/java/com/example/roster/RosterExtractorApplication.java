package com.example.roster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RosterExtractorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(RosterExtractorApplication.class, args)));
    }
}
