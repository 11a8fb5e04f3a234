package com.bko.biketracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BikeTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BikeTrackerApplication.class, args);
    }
}
