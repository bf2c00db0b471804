package com.baykanat.funnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Uygulama giriş noktası. */
@SpringBootApplication
public class FunnelAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(FunnelAnalyticsApplication.class, args);
	}

}
