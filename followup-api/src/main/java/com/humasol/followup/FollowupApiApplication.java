package com.humasol.followup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FollowupApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FollowupApiApplication.class, args);
    }
}
