package com.acme.strmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(StrMatchApplication.class, args);
    }
}
