package com.typehub.raceservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * race-service 启动入口。
 */
@SpringBootApplication
public class RaceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaceServiceApplication.class, args);
    }
}
