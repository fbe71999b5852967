package com.ClaimFlow.expense_backend.service;

import lombok.Value;
import org.springframework.core.io.Resource;

@Value
public class BillFile {
    Resource resource;
    String fileName;
    String contentType;
}
