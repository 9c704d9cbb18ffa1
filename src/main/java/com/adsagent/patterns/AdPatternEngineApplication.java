package com.adsagent.patterns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdPatternEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdPatternEngineApplication.class, args);
    }
}
