package com.streamearn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StreamEarnApplication {
    public static void main(String[] args) {
        SpringApplication.run(StreamEarnApplication.class, args);
    }
}
