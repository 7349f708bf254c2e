package com.example.cvatserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CvatServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvatServerApplication.class, args);
    }

}
