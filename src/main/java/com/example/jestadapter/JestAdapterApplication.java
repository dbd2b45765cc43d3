package com.example.jestadapter;

import com.example.jestadapter.config.AdapterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AdapterProperties.class)
public class JestAdapterApplication {

	public static void main(String[] args) {
		SpringApplication.run(JestAdapterApplication.class, args);
	}

}
