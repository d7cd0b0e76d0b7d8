package ru.vavtech.leavetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeaveTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaveTrackerApplication.class, args);
    }
}
