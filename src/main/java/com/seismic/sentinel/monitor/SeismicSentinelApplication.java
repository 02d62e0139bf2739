package com.seismic.sentinel.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SeismicSentinelApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeismicSentinelApplication.class, args);
	}

}
