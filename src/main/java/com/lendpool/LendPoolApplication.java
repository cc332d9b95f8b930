package com.lendpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendPoolApplication.class, args);
    }
}
