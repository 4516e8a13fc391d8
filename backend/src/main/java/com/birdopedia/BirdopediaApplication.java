package com.birdopedia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BirdopediaApplication {

    public static void main(String[] args) {
        SpringApplication.run(BirdopediaApplication.class, args);
    }
}
