package com.flagship.wager_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WagerEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WagerEngineApplication.class, args);
    }
}
