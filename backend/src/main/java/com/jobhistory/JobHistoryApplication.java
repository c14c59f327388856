package com.jobhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobHistoryApplication.class, args);
    }
}
