package com.ClaimFlow.expense_backend.util;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterParserTest {

    @Test
    void blankMeansNoFilter() {
        assertThat(FilterParser.status(null)).isNull();
        assertThat(FilterParser.category("  ")).isNull();
    }

    @Test
    void valuesAreCaseInsensitive() {
        assertThat(FilterParser.status("hr_review")).isEqualTo(ClaimStatus.HR_REVIEW);
        assertThat(FilterParser.category(" Travel ")).isEqualTo(ExpenseCategory.TRAVEL);
        assertThat(FilterParser.grade("d")).isEqualTo(Grade.D);
    }

    @Test
    void unknownValueIsRejectedWithItsName() {
        assertThatThrownBy(() -> FilterParser.status("pending"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid status: pending");
    }
}
