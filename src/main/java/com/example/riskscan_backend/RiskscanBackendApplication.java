package com.example.riskscan_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RiskscanBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(RiskscanBackendApplication.class, args);
	}

}
