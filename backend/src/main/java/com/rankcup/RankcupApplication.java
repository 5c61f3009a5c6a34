package com.rankcup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RankcupApplication {
    public static void main(String[] args) {
        SpringApplication.run(RankcupApplication.class, args);
    }
}
