package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.dto.response.AuditLogResponse;
import com.ClaimFlow.expense_backend.dto.response.PaginatedResponse;
import com.ClaimFlow.expense_backend.enums.AuditAction;
import com.ClaimFlow.expense_backend.enums.AuditOutcome;
import com.ClaimFlow.expense_backend.enums.ClaimStatus;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import com.ClaimFlow.expense_backend.model.AuditLog;
import com.ClaimFlow.expense_backend.model.ExpenseClaim;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.AuditLogRepository;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ModelMapper modelMapper;
    private final Clock clock;

    @Transactional
    public void logClaimAction(User actor, AuditAction action, ExpenseClaim claim,
                               ClaimStatus beforeStatus, ClaimStatus afterStatus, String detail) {
        save(AuditLog.builder()
                .actorId(actor.getId())
                .actorUsername(actor.getUsername())
                .actorRole(actor.getRole())
                .action(action)
                .outcome(AuditOutcome.SUCCESS)
                .claimId(claim.getId())
                .expenseNumber(claim.getExpenseNumber())
                .beforeStatus(beforeStatus)
                .afterStatus(afterStatus)
                .detail(detail)
                .ipAddress(currentClientIp())
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    /**
     * Records a refused workflow action. Runs in its own transaction so the record survives
     * the rollback of the request that was refused.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logDenied(User actor, AuditAction action, ExpenseClaim claim, String detail) {
        log.warn("Denied {} on {} by {}: {}", action, claim.getExpenseNumber(), actor.getUsername(), detail);
        save(AuditLog.builder()
                .actorId(actor.getId())
                .actorUsername(actor.getUsername())
                .actorRole(actor.getRole())
                .action(action)
                .outcome(AuditOutcome.DENIED)
                .claimId(claim.getId())
                .expenseNumber(claim.getExpenseNumber())
                .beforeStatus(claim.getStatus())
                .detail(detail)
                .ipAddress(currentClientIp())
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    @Transactional
    public void logUserAction(User actor, AuditAction action, User target, String detail) {
        save(AuditLog.builder()
                .actorId(actor.getId())
                .actorUsername(actor.getUsername())
                .actorRole(actor.getRole())
                .action(action)
                .outcome(AuditOutcome.SUCCESS)
                .targetUserId(target.getId())
                .detail(detail)
                .ipAddress(currentClientIp())
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<AuditLogResponse> searchAuditLogs(int page, int limit, UUID actorId,
                                                               String action, UUID claimId) {
        AuditAction auditAction = null;
        if (action != null && !action.isBlank()) {
            try {
                auditAction = AuditAction.valueOf(action.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid audit action: " + action);
            }
        }

        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("createdAt").descending());
        Page<AuditLog> logs = auditLogRepository.search(actorId, auditAction, claimId, pageable);

        return PaginatedResponse.from(logs, entry -> modelMapper.map(entry, AuditLogResponse.class));
    }

    private void save(AuditLog entry) {
        auditLogRepository.save(entry);
        log.debug("Audit {} {} claim={} target={}", entry.getAction(), entry.getOutcome(),
                entry.getExpenseNumber(), entry.getTargetUserId());
    }

    private String currentClientIp() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            return null;
        }
        HttpServletRequest request = ((ServletRequestAttributes) attributes).getRequest();
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
