package com.demoBank.atmDemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AtmDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtmDemoApplication.class, args);
    }
}
