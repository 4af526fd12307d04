package com.analyseloto.stats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StatsEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(StatsEngineApplication.class, args);
	}

}
