package com.ClaimFlow.expense_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExpenseBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseBackendApplication.class, args);
    }
}
