package com.ai.catalogqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogQaApplication {

	public static void main(String[] args) {
		SpringApplication.run(CatalogQaApplication.class, args);
	}

}
