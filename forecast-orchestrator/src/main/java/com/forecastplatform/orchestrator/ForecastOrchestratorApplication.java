package com.forecastplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastOrchestratorApplication.class, args);
    }
}
