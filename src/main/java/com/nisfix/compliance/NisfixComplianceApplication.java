package com.nisfix.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.nisfix.compliance")
@EnableScheduling
@EnableJpaRepositories(basePackages = "com.nisfix.compliance.infrastructure.jpa")
@EntityScan(basePackages = "com.nisfix.compliance.infrastructure.jpa")
public class NisfixComplianceApplication {
	public static void main(String[] args) {
		SpringApplication.run(NisfixComplianceApplication.class, args);
	}
}
