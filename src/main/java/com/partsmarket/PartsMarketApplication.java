package com.partsmarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PartsMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(PartsMarketApplication.class, args);
    }
}
