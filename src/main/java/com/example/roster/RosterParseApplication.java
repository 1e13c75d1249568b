package com.example.roster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RosterParseApplication {

	public static void main(String[] args) {
		SpringApplication.run(RosterParseApplication.class, args);
	}

}
