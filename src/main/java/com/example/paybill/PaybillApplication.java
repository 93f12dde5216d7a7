package com.example.paybill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point of the paybill parser.
 * It only wires the application context and hands control over to Spring.
 */
@SpringBootApplication
public class PaybillApplication {

	public static void main(String[] args) {
		SpringApplication.run(PaybillApplication.class, args);
	}

}
