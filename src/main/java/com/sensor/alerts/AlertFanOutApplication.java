package com.sensor.alerts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertFanOutApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertFanOutApplication.class, args);
    }
}
