package com.riskgate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RiskOrchestratorApplication {
	public static void main(String[] args) {
		SpringApplication.run(RiskOrchestratorApplication.class, args);
	}
}
