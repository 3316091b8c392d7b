package com.outlierai.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OutlierAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutlierAiApplication.class, args);
    }
}
