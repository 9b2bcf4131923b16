package com.sommerph.attestbackend;

import com.sommerph.attestbackend.config.ProtocolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProtocolProperties.class)
public class AttestBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(AttestBackendApplication.class, args);
	}

}
