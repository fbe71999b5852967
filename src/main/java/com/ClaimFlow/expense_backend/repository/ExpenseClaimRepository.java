package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseClaimRepository extends JpaRepository<ExpenseClaim, UUID>,
        JpaSpecificationExecutor<ExpenseClaim> {

    Optional<ExpenseClaim> findByExpenseNumber(String expenseNumber);

    boolean existsByExpenseNumber(String expenseNumber);

    boolean existsByOwner_Id(UUID ownerId);

    @Query("""
        SELECT c FROM ExpenseClaim c
        WHERE c.owner.id = :ownerId
        AND (:status IS NULL OR c.status = :status)
        AND (:category IS NULL OR c.category = :category)
    """)
    Page<ExpenseClaim> findOwnClaims(
            @Param("ownerId") UUID ownerId,
            @Param("status") ClaimStatus status,
            @Param("category") ExpenseCategory category,
            Pageable pageable
    );

    Page<ExpenseClaim> findByStatusInAndOwner_IdNot(Collection<ClaimStatus> statuses, UUID ownerId, Pageable pageable);

    Optional<ExpenseClaim> findFirstByOwner_IdAndBillFileHashAndStatusNot(UUID ownerId, String billFileHash,
                                                                           ClaimStatus excludedStatus);

    /**
     * Moves a claim to {@code next} only if its stored status is still {@code expected}.
     *
     * @return 1 when this caller performed the transition, 0 when the claim had already moved on
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ExpenseClaim c
        SET c.status = :next, c.updatedAt = :now, c.version = c.version + 1
        WHERE c.id = :id AND c.status = :expected
    """)
    int transitionStatus(
            @Param("id") UUID id,
            @Param("expected") ClaimStatus expected,
            @Param("next") ClaimStatus next,
            @Param("now") LocalDateTime now
    );

    @Query("""
        SELECT c.status, COUNT(c), SUM(c.amount) FROM ExpenseClaim c
        WHERE (:fromDate IS NULL OR c.expenseDate >= :fromDate)
        AND (:toDate IS NULL OR c.expenseDate <= :toDate)
        GROUP BY c.status
    """)
    List<Object[]> summarizeByStatus(@Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);

    @Query("""
        SELECT c.category, COUNT(c), SUM(c.amount) FROM ExpenseClaim c
        WHERE (:fromDate IS NULL OR c.expenseDate >= :fromDate)
        AND (:toDate IS NULL OR c.expenseDate <= :toDate)
        GROUP BY c.category
        ORDER BY SUM(c.amount) DESC
    """)
    List<Object[]> summarizeByCategory(@Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);

    long countByStatus(ClaimStatus status);
}
