package com.jquest.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JquestApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(JquestApiApplication.class, args);
    }
}
