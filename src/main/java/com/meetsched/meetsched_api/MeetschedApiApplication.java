package com.meetsched.meetsched_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetschedApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetschedApiApplication.class, args);
    }
}
