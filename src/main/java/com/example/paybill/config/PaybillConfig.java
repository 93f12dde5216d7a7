package com.example.paybill.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(PaybillProperties.class)
public class PaybillConfig {

    public static final String DOCUMENT_EXECUTOR = "paybillDocumentExecutor";

    @Bean(name = DOCUMENT_EXECUTOR)
    public Executor paybillDocumentExecutor(PaybillProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.documentParallelism());
        executor.setMaxPoolSize(properties.documentParallelism());
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("paybill-document-");
        // a full queue makes the submitting thread parse the document itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
