package com.ClaimFlow.expense_backend.dto.request;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Multipart claim submission. Enum-like fields stay strings and are parsed by the service
 * so that unknown values produce a field-level validation error.
 */
@Data
public class ExpenseClaimRequest {

    @NotBlank(message = "Category is required")
    private String category;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 10, fraction = 2, message = "Amount must have at most 2 decimal places")
    private BigDecimal amount;

    @NotNull(message = "Expense date is required")
    @PastOrPresent(message = "Expense date cannot be in the future")
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate expenseDate;

    @NotBlank(message = "Description is required")
    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;

    private String travelMode;

    @Size(max = 255, message = "Travel origin must not exceed 255 characters")
    private String travelFrom;

    @Size(max = 255, message = "Travel destination must not exceed 255 characters")
    private String travelTo;

    @NotNull(message = "Bill file is required")
    private MultipartFile billFile;
}
