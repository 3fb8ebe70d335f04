package com.feeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeeGuardApplication.class, args);
    }
}
