package com.example.routex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoutexBroadcastApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutexBroadcastApplication.class, args);
    }

}
