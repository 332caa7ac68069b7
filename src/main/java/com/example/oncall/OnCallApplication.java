package com.example.oncall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OnCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnCallApplication.class, args);
    }
}
