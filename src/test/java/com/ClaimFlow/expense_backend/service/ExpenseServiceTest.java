package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.request.ExpenseClaimRequest;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.GradeRulesResponse;
import com.ClaimFlow.expense_backend.enums.AiRecommendation;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Grade;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import com.ClaimFlow.expense_backend.event.ClaimStatusChangedEvent;
import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.exception.DuplicateBillException;
import com.ClaimFlow.expense_backend.exception.ForbiddenException;
import com.ClaimFlow.expense_backend.exception.InvalidStateException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.service.analysis.BillAnalyzer;
import com.ClaimFlow.expense_backend.service.analysis.ClaimContext;
import com.ClaimFlow.expense_backend.util.ExpenseNumberGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpenseServiceTest {

    private static final String BILL_PATH = "2024/06/bill.pdf";
    private static final byte[] BILL_CONTENT = "%PDF-1.4 ticket".getBytes(StandardCharsets.UTF_8);
    private static final String BILL_HASH = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";

    @Mock
    private ExpenseClaimRepository expenseClaimRepository;

    @Mock
    private ApprovalDecisionRepository approvalDecisionRepository;

    @Mock
    private BillStorageService billStorageService;

    @Mock
    private BillAnalyzer billAnalyzer;

    @Mock
    private AuditService auditService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ExpenseService expenseService;
    private User employee;
    private MockMultipartFile billFile;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-03T06:30:00Z"), ZoneId.of("Asia/Kolkata"));
        GradeLimitPolicy policy = PolicyFixtures.defaultPolicy();
        expenseService = new ExpenseService(expenseClaimRepository, approvalDecisionRepository, billStorageService,
                billAnalyzer, new LimitValidator(policy), policy, new ApprovalStateMachine(), auditService,
                new ExpenseClaimMapper(), new ExpenseNumberGenerator(clock), eventPublisher,
                new TransactionTemplate(mock(PlatformTransactionManager.class)), clock);

        employee = User.builder()
                .id(UUID.randomUUID())
                .username("asha")
                .fullName("Asha Rao")
                .employeeCode("EMP007")
                .role(Role.EMPLOYEE)
                .grade(Grade.A)
                .active(true)
                .canClaimExpenses(true)
                .build();
        billFile = new MockMultipartFile("billFile", "ticket.pdf", "application/pdf", BILL_CONTENT);
    }

    @Test
    void claimIsSubmittedWithoutAnalysisWhenAnalyzerFails() {
        storesBill();
        savesClaims();
        when(billAnalyzer.analyze(any(), any())).thenThrow(new AnalysisUnavailableException("Gemini timed out"));

        ExpenseClaimResponse response = expenseService.submitClaim(employee, travelRequest("1200", "bus"));

        assertThat(response.getStatus()).isEqualTo(ClaimStatus.SUBMITTED);
        assertThat(response.isWithinLimits()).isTrue();
        assertThat(response.isAnalysisPresent()).isFalse();
        assertThat(response.getAnalysis()).isNull();
        assertThat(response.getTravelMode()).isEqualTo(TravelMode.BUS);
        assertThat(response.getCurrency()).isEqualTo("INR");
        assertThat(response.getExpenseNumber()).startsWith("EXP-20240603-");

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        ClaimStatusChangedEvent submitted = (ClaimStatusChangedEvent) event.getValue();
        assertThat(submitted.getFromStatus()).isNull();
        assertThat(submitted.getToStatus()).isEqualTo(ClaimStatus.SUBMITTED);

        verify(auditService).logClaimAction(eq(employee), eq(AuditAction.CLAIM_SUBMITTED), any(ExpenseClaim.class),
                isNull(), eq(ClaimStatus.SUBMITTED), anyString());
    }

    @Test
    void analyzerReceivesGradeRules() {
        storesBill();
        savesClaims();
        when(billAnalyzer.analyze(any(), any())).thenThrow(new AnalysisUnavailableException("offline"));

        expenseService.submitClaim(employee, travelRequest("1200", "bus"));

        ArgumentCaptor<ClaimContext> context = ArgumentCaptor.forClass(ClaimContext.class);
        verify(billAnalyzer).analyze(any(), context.capture());
        assertThat(context.getValue().getCategoryLimit()).isEqualByComparingTo("1500");
        assertThat(context.getValue().getAllowedTravelModes()).containsExactlyInAnyOrder(TravelMode.BUS, TravelMode.TRAIN);
        assertThat(context.getValue().getGrade()).isEqualTo(Grade.A);
    }

    @Test
    void overLimitClaimIsStillSubmittedButFlagged() {
        storesBill();
        savesClaims();
        when(billAnalyzer.analyze(any(), any())).thenThrow(new AnalysisUnavailableException("offline"));

        ExpenseClaimRequest request = travelRequest("1800", "bus");
        ExpenseClaimResponse response = expenseService.submitClaim(employee, request);

        assertThat(response.getStatus()).isEqualTo(ClaimStatus.SUBMITTED);
        assertThat(response.isWithinLimits()).isFalse();
        assertThat(response.getLimitReason()).contains("exceeds grade A limit");
    }

    @Test
    void travelDetailsFallBackToAnalysis() {
        storesBill();
        savesClaims();
        when(billAnalyzer.analyze(any(), any())).thenReturn(BillAnalysis.builder()
                .authentic(true)
                .confidenceScore(88)
                .vendorName("Deccan Queen")
                .extractedAmount(new BigDecimal("650"))
                .travelMode("train")
                .travelRoute("Pune to Mumbai")
                .recommendation(AiRecommendation.APPROVE)
                .recommendationReason("Valid ticket")
                .summary("Train ticket")
                .flaggedIssues(List.of("No GST number"))
                .build());

        ExpenseClaimRequest request = travelRequest("650", null);
        ExpenseClaimResponse response = expenseService.submitClaim(employee, request);

        assertThat(response.getTravelMode()).isEqualTo(TravelMode.TRAIN);
        assertThat(response.getTravelFrom()).isEqualTo("Pune");
        assertThat(response.getTravelTo()).isEqualTo("Mumbai");
        assertThat(response.isAnalysisPresent()).isTrue();
        assertThat(response.getAnalysis().getConfidenceScore()).isEqualTo(88);
        // owners get the reduced view
        assertThat(response.getAnalysis().getRecommendation()).isNull();
        assertThat(response.getAnalysis().getFlaggedIssues()).isNull();
    }

    @Test
    void travelPlacesFromAnalysisAreClippedToColumnSize() {
        storesBill();
        savesClaims();
        when(billAnalyzer.analyze(any(), any())).thenReturn(BillAnalysis.builder()
                .confidenceScore(60)
                .travelRoute("P".repeat(400) + " to " + "M".repeat(400))
                .recommendation(AiRecommendation.REVIEW)
                .build());

        ExpenseClaimResponse response = expenseService.submitClaim(employee, travelRequest("650", "bus"));

        assertThat(response.getTravelFrom()).hasSize(ExpenseClaim.PLACE_LENGTH);
        assertThat(response.getTravelTo()).hasSize(ExpenseClaim.PLACE_LENGTH);
    }

    @Test
    void duplicateBillIsRejectedBeforeAnalysis() {
        when(billStorageService.read(billFile)).thenReturn(
                new StoredBill(BILL_CONTENT, "ticket.pdf", "application/pdf", BILL_HASH));
        when(expenseClaimRepository.findFirstByOwner_IdAndBillFileHashAndStatusNot(employee.getId(), BILL_HASH, ClaimStatus.REJECTED))
                .thenReturn(Optional.of(ExpenseClaim.builder().expenseNumber("EXP-20240601-0A0B0C").build()));

        assertThatThrownBy(() -> expenseService.submitClaim(employee, travelRequest("1200", "bus")))
                .isInstanceOf(DuplicateBillException.class)
                .hasMessageContaining("EXP-20240601-0A0B0C");

        verifyNoInteractions(billAnalyzer);
        verify(billStorageService, never()).save(any());
        verify(expenseClaimRepository, never()).save(any());
    }

    @Test
    void unknownCategoryIsAValidationError() {
        ExpenseClaimRequest request = travelRequest("100", null);
        request.setCategory("lottery");

        assertThatThrownBy(() -> expenseService.submitClaim(employee, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("lottery");
        verifyNoInteractions(billStorageService, billAnalyzer);
    }

    @Test
    void unknownTravelModeIsAValidationError() {
        assertThatThrownBy(() -> expenseService.submitClaim(employee, travelRequest("100", "rocket")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void employeeWithoutClaimPermissionIsRefused() {
        employee.setCanClaimExpenses(false);

        assertThatThrownBy(() -> expenseService.submitClaim(employee, travelRequest("100", "bus")))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void storedBillIsRemovedWhenPersistingFails() {
        storesBill();
        when(billAnalyzer.analyze(any(), any())).thenThrow(new AnalysisUnavailableException("offline"));
        when(expenseClaimRepository.save(any(ExpenseClaim.class))).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> expenseService.submitClaim(employee, travelRequest("1200", "bus")))
                .isInstanceOf(IllegalStateException.class);

        verify(billStorageService).delete(BILL_PATH);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void onlySubmittedClaimsCanBeDeleted() {
        UUID claimId = UUID.randomUUID();
        when(expenseClaimRepository.findById(claimId)).thenReturn(Optional.of(ExpenseClaim.builder()
                .id(claimId)
                .owner(employee)
                .status(ClaimStatus.HR_REVIEW)
                .build()));

        assertThatThrownBy(() -> expenseService.deleteExpense(employee, claimId))
                .isInstanceOf(InvalidStateException.class);
        verify(expenseClaimRepository, never()).delete(any(ExpenseClaim.class));
        verify(auditService).logDenied(eq(employee), eq(AuditAction.CLAIM_DELETED), any(ExpenseClaim.class),
                eq("Claim already hr_review"));
    }

    @Test
    void ownerDeletesSubmittedClaimAndItsBill() {
        UUID claimId = UUID.randomUUID();
        ExpenseClaim claim = ExpenseClaim.builder()
                .id(claimId)
                .expenseNumber("EXP-20240603-ABCDEF")
                .owner(employee)
                .status(ClaimStatus.SUBMITTED)
                .billFilePath(BILL_PATH)
                .build();
        when(expenseClaimRepository.findById(claimId)).thenReturn(Optional.of(claim));

        expenseService.deleteExpense(employee, claimId);

        verify(expenseClaimRepository).delete(claim);
        verify(billStorageService).delete(BILL_PATH);
        verify(auditService).logClaimAction(employee, AuditAction.CLAIM_DELETED, claim, ClaimStatus.SUBMITTED, null, null);
    }

    @Test
    void otherEmployeesCannotDeleteOrViewAClaim() {
        UUID claimId = UUID.randomUUID();
        User colleague = User.builder().id(UUID.randomUUID()).username("ravi").role(Role.EMPLOYEE).grade(Grade.A).build();
        when(expenseClaimRepository.findById(claimId)).thenReturn(Optional.of(ExpenseClaim.builder()
                .id(claimId)
                .owner(employee)
                .status(ClaimStatus.SUBMITTED)
                .build()));

        assertThatThrownBy(() -> expenseService.deleteExpense(colleague, claimId))
                .isInstanceOf(ForbiddenException.class);
        verify(auditService).logDenied(eq(colleague), eq(AuditAction.CLAIM_DELETED), any(ExpenseClaim.class),
                eq("Caller is not the claim owner"));
        assertThatThrownBy(() -> expenseService.getExpenseById(colleague, claimId))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void rulesDescribeTheCallersGrade() {
        GradeRulesResponse rules = expenseService.getRules(employee);

        assertThat(rules.getGrade()).isEqualTo(Grade.A);
        assertThat(rules.getLimits()).containsEntry("travel", new BigDecimal("1500"));
        assertThat(rules.getAllowedTravelModes()).containsExactly(TravelMode.BUS, TravelMode.TRAIN);
    }

    private void storesBill() {
        when(billStorageService.read(billFile)).thenReturn(
                new StoredBill(BILL_CONTENT, "ticket.pdf", "application/pdf", BILL_HASH));
        when(billStorageService.save(any(StoredBill.class))).thenReturn(BILL_PATH);
    }

    private void savesClaims() {
        when(expenseClaimRepository.save(any(ExpenseClaim.class))).thenAnswer(invocation -> {
            ExpenseClaim claim = invocation.getArgument(0);
            claim.setId(UUID.randomUUID());
            return claim;
        });
    }

    private ExpenseClaimRequest travelRequest(String amount, String travelMode) {
        ExpenseClaimRequest request = new ExpenseClaimRequest();
        request.setCategory("travel");
        request.setAmount(new BigDecimal(amount));
        request.setExpenseDate(LocalDate.of(2024, 6, 1));
        request.setDescription("Client visit");
        request.setTravelMode(travelMode);
        request.setBillFile(billFile);
        return request;
    }
}
