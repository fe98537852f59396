package com.yerin.bgworker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BgWorkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(BgWorkerApplication.class, args);
	}

}
