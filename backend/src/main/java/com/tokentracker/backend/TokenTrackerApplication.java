package com.tokentracker.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TokenTrackerApplication {

	public static void main(String[] args) {
		// UTC everywhere so DATE columns and audit timestamps line up
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(TokenTrackerApplication.class, args);
	}

}
