package ru.tigran.assistantloganalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssistantLogAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantLogAnalyticsApplication.class, args);
    }
}
