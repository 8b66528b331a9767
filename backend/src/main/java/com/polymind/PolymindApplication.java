package com.polymind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PolymindApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolymindApplication.class, args);
    }
}
