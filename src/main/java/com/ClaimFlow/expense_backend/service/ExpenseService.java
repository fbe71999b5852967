package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.request.ExpenseClaimRequest;
import com.ClaimFlow.expense_backend.dto.response.BillStatusResponse;
import com.ClaimFlow.expense_backend.dto.response.ExpenseClaimResponse;
import com.ClaimFlow.expense_backend.dto.response.GradeRulesResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.Permission;
import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import com.ClaimFlow.expense_backend.event.ClaimStatusChangedEvent;
import com.ClaimFlow.expense_backend.exception.AnalysisUnavailableException;
import com.ClaimFlow.expense_backend.exception.ApiException;
import com.ClaimFlow.expense_backend.exception.DuplicateBillException;
import com.ClaimFlow.expense_backend.exception.ForbiddenException;
import com.ClaimFlow.expense_backend.exception.InvalidStateException;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.ApprovalDecision;
import com.ClaimFlow.expense_backend.model.BillAnalysis;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.ApprovalDecisionRepository;
import com.ClaimFlow.expense_backend.repository.ExpenseClaimRepository;
import com.ClaimFlow.expense_backend.service.analysis.BillAnalyzer;
import com.ClaimFlow.expense_backend.service.analysis.BillDocument;
import com.ClaimFlow.expense_backend.service.analysis.ClaimContext;
import com.ClaimFlow.expense_backend.util.ExpenseNumberGenerator;
import com.ClaimFlow.expense_backend.util.FilterParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private static final String REQUEST = "expenseClaimRequest";
    private static final Pattern ROUTE_SEPARATOR = Pattern.compile("\\s+-\\s+|\\s+to\\s+|\\s*->\\s*", Pattern.CASE_INSENSITIVE);
    private static final int EXPENSE_NUMBER_ATTEMPTS = 5;

    private final ExpenseClaimRepository expenseClaimRepository;
    private final ApprovalDecisionRepository approvalDecisionRepository;
    private final BillStorageService billStorageService;
    private final BillAnalyzer billAnalyzer;
    private final LimitValidator limitValidator;
    private final GradeLimitPolicy gradeLimitPolicy;
    private final ApprovalStateMachine stateMachine;
    private final AuditService auditService;
    private final ExpenseClaimMapper claimMapper;
    private final ExpenseNumberGenerator expenseNumberGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Stores the bill, asks the analyzer for an opinion and records the claim as SUBMITTED.
     * The analyzer runs outside the database transaction; if it is unavailable the claim is
     * still created, without analysis.
     */
    public ExpenseClaimResponse submitClaim(User owner, ExpenseClaimRequest request) {
        if (!owner.hasPermission(Permission.CLAIM_EXPENSE)) {
            throw new ForbiddenException("You are not allowed to submit expense claims");
        }

        ExpenseCategory category = ExpenseCategory.fromString(request.getCategory());
        if (category == null) {
            throw ValidationException.forField(REQUEST, "category", "Invalid category: " + request.getCategory());
        }
        TravelMode travelMode = null;
        if (category == ExpenseCategory.TRAVEL && request.getTravelMode() != null && !request.getTravelMode().isBlank()) {
            travelMode = TravelMode.fromString(request.getTravelMode());
            if (travelMode == null) {
                throw ValidationException.forField(REQUEST, "travelMode", "Invalid travel mode: " + request.getTravelMode());
            }
        }

        StoredBill bill = billStorageService.read(request.getBillFile());
        expenseClaimRepository.findFirstByOwner_IdAndBillFileHashAndStatusNot(owner.getId(), bill.getSha256(), ClaimStatus.REJECTED)
                .ifPresent(existing -> {
                    throw new DuplicateBillException(existing.getExpenseNumber());
                });

        BillAnalysis analysis = analyze(owner, request, category, travelMode, bill);

        String travelFrom = null;
        String travelTo = null;
        if (category == ExpenseCategory.TRAVEL) {
            travelFrom = blankToNull(request.getTravelFrom());
            travelTo = blankToNull(request.getTravelTo());
            if (analysis != null) {
                if (travelMode == null) {
                    travelMode = TravelMode.fromString(analysis.getTravelMode());
                }
                if ((travelFrom == null || travelTo == null) && analysis.getTravelRoute() != null) {
                    String[] route = ROUTE_SEPARATOR.split(analysis.getTravelRoute().trim(), 2);
                    if (route.length == 2) {
                        travelFrom = travelFrom != null ? travelFrom : routePart(route[0]);
                        travelTo = travelTo != null ? travelTo : routePart(route[1]);
                    }
                }
            }
        }

        LimitCheckResult limitCheck = limitValidator.check(owner.getGrade(), category, request.getAmount(), travelMode);

        String billPath = billStorageService.save(bill);
        ExpenseClaim claim = ExpenseClaim.builder()
                .owner(owner)
                .ownerName(owner.getFullName())
                .category(category)
                .amount(request.getAmount())
                .currency(gradeLimitPolicy.getCurrency())
                .expenseDate(request.getExpenseDate())
                .description(request.getDescription().trim())
                .travelMode(travelMode)
                .travelFrom(travelFrom)
                .travelTo(travelTo)
                .billFilePath(billPath)
                .billFileName(bill.getOriginalFileName())
                .billContentType(bill.getContentType())
                .billFileHash(bill.getSha256())
                .status(ClaimStatus.SUBMITTED)
                .withinLimits(limitCheck.isWithinLimits())
                .limitReason(limitCheck.getReason())
                .analysisPresent(analysis != null)
                .billAnalysis(analysis)
                .submittedAt(LocalDateTime.now(clock))
                .build();

        ExpenseClaim saved;
        try {
            saved = transactionTemplate.execute(status -> persistNewClaim(owner, claim));
        } catch (RuntimeException e) {
            billStorageService.delete(billPath);
            throw e;
        }

        log.info("Expense claim {} submitted by {} (withinLimits={}, analysisPresent={})",
                saved.getExpenseNumber(), owner.getUsername(), saved.isWithinLimits(), saved.isAnalysisPresent());
        return claimMapper.toResponse(saved, owner);
    }

    private ExpenseClaim persistNewClaim(User owner, ExpenseClaim claim) {
        claim.setExpenseNumber(nextExpenseNumber());
        ExpenseClaim saved = expenseClaimRepository.save(claim);

        auditService.logClaimAction(owner, AuditAction.CLAIM_SUBMITTED, saved, null, ClaimStatus.SUBMITTED,
                String.format("%s %s %s", saved.getCategory().getValue(), saved.getCurrency(), saved.getAmount().toPlainString()));

        eventPublisher.publishEvent(ClaimStatusChangedEvent.builder()
                .claimId(saved.getId())
                .expenseNumber(saved.getExpenseNumber())
                .ownerId(owner.getId())
                .ownerName(saved.getOwnerName())
                .amount(saved.getAmount())
                .fromStatus(null)
                .toStatus(ClaimStatus.SUBMITTED)
                .actorId(owner.getId())
                .actorName(owner.getFullName())
                .actorRole(owner.getRole())
                .build());
        return saved;
    }

    private BillAnalysis analyze(User owner, ExpenseClaimRequest request, ExpenseCategory category,
                                 TravelMode travelMode, StoredBill bill) {
        ClaimContext context = ClaimContext.builder()
                .category(category)
                .amount(request.getAmount())
                .currency(gradeLimitPolicy.getCurrency())
                .grade(owner.getGrade())
                .description(request.getDescription())
                .expenseDate(request.getExpenseDate())
                .travelMode(travelMode)
                .categoryLimit(gradeLimitPolicy.ceiling(owner.getGrade(), category).orElse(null))
                .allowedTravelModes(gradeLimitPolicy.allowedTravelModes(owner.getGrade()))
                .build();
        try {
            return billAnalyzer.analyze(
                    new BillDocument(bill.getContent(), bill.getContentType(), bill.getOriginalFileName()), context);
        } catch (AnalysisUnavailableException e) {
            log.warn("Bill analysis unavailable for {}'s claim, continuing without it: {}",
                    owner.getUsername(), e.getMessage());
            return null;
        }
    }

    private String nextExpenseNumber() {
        for (int attempt = 0; attempt < EXPENSE_NUMBER_ATTEMPTS; attempt++) {
            String candidate = expenseNumberGenerator.next();
            if (!expenseClaimRepository.existsByExpenseNumber(candidate)) {
                return candidate;
            }
        }
        throw new ApiException("Could not allocate an expense number", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<ExpenseClaimResponse> getMyExpenses(User owner, int page, int limit,
                                                                 String status, String category) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("submittedAt").descending());
        Page<ExpenseClaim> claims = expenseClaimRepository.findOwnClaims(
                owner.getId(), FilterParser.status(status), FilterParser.category(category), pageable);

        return PaginatedResponse.from(claims, claim -> claimMapper.toResponse(claim, owner));
    }

    @Transactional(readOnly = true)
    public ExpenseClaimResponse getExpenseById(User viewer, UUID id) {
        ExpenseClaim claim = findVisibleClaim(viewer, id);
        List<ApprovalDecision> decisions = approvalDecisionRepository.findByClaim_IdOrderByDecidedAtAsc(claim.getId());
        return claimMapper.toResponse(claim, decisions, viewer);
    }

    @Transactional(readOnly = true)
    public BillStatusResponse getBillStatus(User viewer, String expenseNumber) {
        ExpenseClaim claim = expenseClaimRepository.findByExpenseNumber(expenseNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "expenseNumber", expenseNumber));
        checkVisible(viewer, claim);

        return BillStatusResponse.builder()
                .id(claim.getId())
                .expenseNumber(claim.getExpenseNumber())
                .status(claim.getStatus())
                .pendingWith(stateMachine.stageRole(claim.getStatus()).map(Role::getValue).orElse(null))
                .analysisPresent(claim.isAnalysisPresent())
                .rejectionReason(claim.getRejectionReason())
                .submittedAt(claim.getSubmittedAt())
                .updatedAt(claim.getUpdatedAt())
                .build();
    }

    @Transactional
    public void deleteExpense(User owner, UUID id) {
        ExpenseClaim claim = expenseClaimRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", id));

        if (!claim.isOwnedBy(owner.getId())) {
            auditService.logDenied(owner, AuditAction.CLAIM_DELETED, claim, "Caller is not the claim owner");
            throw new ForbiddenException("Only the owner can delete an expense claim");
        }
        if (claim.getStatus() != ClaimStatus.SUBMITTED) {
            auditService.logDenied(owner, AuditAction.CLAIM_DELETED, claim,
                    "Claim already " + claim.getStatus().getValue());
            throw new InvalidStateException("Only submitted claims that are not yet under review can be deleted",
                    claim.getStatus());
        }

        auditService.logClaimAction(owner, AuditAction.CLAIM_DELETED, claim, claim.getStatus(), null, null);
        expenseClaimRepository.delete(claim);
        expenseClaimRepository.flush();
        billStorageService.delete(claim.getBillFilePath());
        log.info("Expense claim {} deleted by {}", claim.getExpenseNumber(), owner.getUsername());
    }

    @Transactional(readOnly = true)
    public BillFile getBillFile(User viewer, UUID id) {
        ExpenseClaim claim = findVisibleClaim(viewer, id);
        return new BillFile(billStorageService.load(claim.getBillFilePath()),
                claim.getBillFileName(), claim.getBillContentType());
    }

    public GradeRulesResponse getRules(User user) {
        Map<String, BigDecimal> limits = new LinkedHashMap<>();
        gradeLimitPolicy.limitsFor(user.getGrade()).forEach((category, max) -> limits.put(category.getValue(), max));

        return GradeRulesResponse.builder()
                .grade(user.getGrade())
                .currency(gradeLimitPolicy.getCurrency())
                .limits(limits)
                .allowedTravelModes(gradeLimitPolicy.allowedTravelModes(user.getGrade()).stream()
                        .sorted()
                        .collect(Collectors.toList()))
                .build();
    }

    ExpenseClaim findVisibleClaim(User viewer, UUID id) {
        ExpenseClaim claim = expenseClaimRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", id));
        checkVisible(viewer, claim);
        return claim;
    }

    private void checkVisible(User viewer, ExpenseClaim claim) {
        if (!claim.isOwnedBy(viewer.getId()) && !viewer.hasPermission(Permission.VIEW_ALL_EXPENSES)) {
            throw new ForbiddenException("You are not allowed to view this expense claim");
        }
    }

    private static String routePart(String value) {
        String place = value.trim();
        return place.length() > ExpenseClaim.PLACE_LENGTH ? place.substring(0, ExpenseClaim.PLACE_LENGTH) : place;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
