package com.example.gcsconnector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GcsConnectorApplication {

	public static void main(String[] args) {
		SpringApplication.run(GcsConnectorApplication.class, args);
	}

}
