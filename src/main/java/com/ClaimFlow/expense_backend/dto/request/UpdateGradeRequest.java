package com.ClaimFlow.expense_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateGradeRequest {

    @NotBlank(message = "Grade is required")
    private String grade;
}
