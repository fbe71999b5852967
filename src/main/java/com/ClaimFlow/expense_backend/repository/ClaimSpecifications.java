package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.dto.request.ClaimSearchCriteria;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

public final class ClaimSpecifications {

    private ClaimSpecifications() {
        // Utility class, no instantiation
    }

    public static Specification<ExpenseClaim> matching(ClaimSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            Join<ExpenseClaim, User> owner = root.join("owner", JoinType.INNER);

            if (criteria.getQ() != null && !criteria.getQ().isBlank()) {
                String term = "%" + criteria.getQ().trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("description")), term),
                        cb.like(cb.lower(root.get("expenseNumber")), term),
                        cb.like(cb.lower(root.get("billAnalysis").get("vendorName")), term),
                        cb.like(cb.lower(root.get("billAnalysis").get("billNumber")), term),
                        cb.like(cb.lower(owner.get("fullName")), term),
                        cb.like(cb.lower(owner.get("employeeCode")), term)
                ));
            }
            if (criteria.getCategory() != null) {
                predicates.add(cb.equal(root.get("category"), criteria.getCategory()));
            }
            if (criteria.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.getStatus()));
            }
            if (criteria.getEmployeeId() != null) {
                predicates.add(cb.equal(owner.get("id"), criteria.getEmployeeId()));
            }
            if (criteria.getGrade() != null) {
                predicates.add(cb.equal(owner.get("grade"), criteria.getGrade()));
            }
            if (criteria.getDepartment() != null && !criteria.getDepartment().isBlank()) {
                predicates.add(cb.like(cb.lower(owner.get("department")),
                        "%" + criteria.getDepartment().trim().toLowerCase() + "%"));
            }
            if (criteria.getMinAmount() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("amount"), criteria.getMinAmount()));
            }
            if (criteria.getMaxAmount() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("amount"), criteria.getMaxAmount()));
            }
            if (criteria.getFromDate() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("expenseDate"), criteria.getFromDate()));
            }
            if (criteria.getToDate() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("expenseDate"), criteria.getToDate()));
            }
            if (criteria.getAiRecommendation() != null) {
                predicates.add(cb.equal(root.get("billAnalysis").get("recommendation"), criteria.getAiRecommendation()));
            }
            if (criteria.getWithinLimits() != null) {
                predicates.add(cb.equal(root.get("withinLimits"), criteria.getWithinLimits()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
