package com.smpost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmPostApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmPostApplication.class, args);
    }
}
