package com.example.scenebrain_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ScenebrainBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScenebrainBackendApplication.class, args);
	}

}
