package com.tony.hockeyAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HockeyAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(HockeyAnalyticsApplication.class, args);
	}

}
