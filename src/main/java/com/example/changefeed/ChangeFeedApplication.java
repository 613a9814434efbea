package com.example.changefeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // heartbeats and dead-letter maintenance
public class ChangeFeedApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChangeFeedApplication.class, args);
    }
}
