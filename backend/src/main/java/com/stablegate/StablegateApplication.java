package com.stablegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StablegateApplication {

    public static void main(String[] args) {
        SpringApplication.run(StablegateApplication.class, args);
    }
}
