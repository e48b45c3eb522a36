package com.lendrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendRiskApplication {
    public static void main(String[] args) {
        SpringApplication.run(LendRiskApplication.class, args);
    }
}
