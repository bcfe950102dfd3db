package com.swissdraw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwissDrawApplication {
    public static void main(String[] args) {
        SpringApplication.run(SwissDrawApplication.class, args);
    }
}
