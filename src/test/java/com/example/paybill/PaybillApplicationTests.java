package com.example.paybill;

import com.example.paybill.application.service.PayrollProcessingService;
import com.example.paybill.config.PaybillProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class PaybillApplicationTests {

	@Autowired
	private PayrollProcessingService processingService;

	@Autowired
	private PaybillProperties properties;

	@Test
	void contextLoads() {
		assertThat(processingService).isNotNull();
	}

	@Test
	void propertiesAreBoundFromApplicationProperties() {
		assertThat(properties.amountTolerance()).isEqualByComparingTo(new BigDecimal("1.00"));
		assertThat(properties.documentParallelism()).isEqualTo(2);
	}

}
