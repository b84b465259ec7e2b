package com.di.recalibrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecalibratorApplication {

	public static void main(String[] args) {
		// Exit code comes from RecalibratorCommandRunner
		System.exit(SpringApplication.exit(SpringApplication.run(RecalibratorApplication.class, args)));
	}
}
