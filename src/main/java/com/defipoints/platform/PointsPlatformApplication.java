package com.defipoints.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PointsPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(PointsPlatformApplication.class, args);
    }
}
