package com.energy.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConsumptionAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsumptionAnomalyApplication.class, args);
    }
}
