package com.example.Battery_Operating_Plan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BatteryOperatingPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatteryOperatingPlanApplication.class, args);
    }
}
