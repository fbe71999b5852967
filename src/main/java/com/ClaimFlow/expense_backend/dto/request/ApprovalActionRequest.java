package com.ClaimFlow.expense_backend.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalActionRequest {

    @Size(max = 2000, message = "Comments must not exceed 2000 characters")
    private String comments;
}
