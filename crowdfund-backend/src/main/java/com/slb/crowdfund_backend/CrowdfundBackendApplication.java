package com.slb.crowdfund_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.crowdfund_backend")
public class CrowdfundBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(CrowdfundBackendApplication.class, args);
	}

}
