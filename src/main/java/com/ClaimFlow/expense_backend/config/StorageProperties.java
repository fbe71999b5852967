package com.ClaimFlow.expense_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "storage")
@Data
public class StorageProperties {
    private String uploadDir = "uploads";
    private long maxFileSizeMb = 10;
    private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "jpg", "jpeg", "png"));
}
