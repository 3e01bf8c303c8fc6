package com.example.voiceover_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceoverBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(VoiceoverBackendApplication.class, args);
	}

}
