package com.example.forecast;

import com.example.forecast.config.ForecastProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ForecastProperties.class)
public class ForecastPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(ForecastPipelineApplication.class, args);
	}

}
