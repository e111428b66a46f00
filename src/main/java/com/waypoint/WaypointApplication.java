package com.waypoint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaypointApplication {

    public static void main(String[] args) {
        SpringApplication.run(WaypointApplication.class, args);
    }
}
