package com.recordhub.phoneauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PhoneAuthApplication {

	public static void main(String[] args) {
		SpringApplication.run(PhoneAuthApplication.class, args);
	}

}
