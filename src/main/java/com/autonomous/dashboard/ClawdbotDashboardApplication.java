package com.autonomous.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClawdbotDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawdbotDashboardApplication.class, args);
    }
}
