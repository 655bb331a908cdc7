package com.derivsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DerivSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(DerivSimApplication.class, args);
    }
}
