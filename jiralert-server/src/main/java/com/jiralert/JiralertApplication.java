package com.jiralert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JiralertApplication {

    public static void main(String[] args) {
        SpringApplication.run(JiralertApplication.class, args);
    }
}
