package com.portfoliorisk.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioRiskApplication {
	public static void main(String[] args) {
		SpringApplication.run(PortfolioRiskApplication.class, args);
	}
}
