package com.example.scenariogen;

import com.example.scenariogen.config.ScenarioProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ScenarioProperties.class)
public class ScenarioGenApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScenarioGenApplication.class, args);
	}

}
