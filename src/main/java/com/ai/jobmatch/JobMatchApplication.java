package com.ai.jobmatch;

import com.ai.jobmatch.config.AiModelConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AiModelConfig.class)
public class JobMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(JobMatchApplication.class, args);
    }
}
