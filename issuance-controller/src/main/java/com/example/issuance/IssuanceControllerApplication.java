package com.example.issuance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IssuanceControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssuanceControllerApplication.class, args);
    }
}
