package com.di.logingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LogIngestApplication {

	public static void main(String[] args) {
		SpringApplication.run(LogIngestApplication.class, args);
	}
}
