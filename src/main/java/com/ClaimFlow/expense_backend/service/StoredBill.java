package com.ClaimFlow.expense_backend.service;

import lombok.Value;

/**
 * A validated upload held in memory until it is written to disk.
 */
@Value
public class StoredBill {
    byte[] content;
    String originalFileName;
    String contentType;
    String sha256;
}
