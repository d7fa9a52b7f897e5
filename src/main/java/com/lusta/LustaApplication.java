package com.lusta;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LustaApplication {
    public static void main(String[] args) {
        SpringApplication.run(LustaApplication.class, args);
    }
}
