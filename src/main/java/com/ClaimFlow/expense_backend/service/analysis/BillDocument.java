package com.ClaimFlow.expense_backend.service.analysis;

import lombok.Value;

@Value
public class BillDocument {
    byte[] content;
    String contentType;
    String fileName;
}
