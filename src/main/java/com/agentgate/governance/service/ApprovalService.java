package com.agentgate.governance.service;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.config.MetricsConfig;
import com.agentgate.governance.exception.ApprovalAlreadyDecidedException;
import com.agentgate.governance.exception.ApprovalExpiredException;
import com.agentgate.governance.exception.ApprovalInvalidSignatureException;
import com.agentgate.governance.exception.ApprovalNotApprovedException;
import com.agentgate.governance.exception.ApprovalNotFoundException;
import com.agentgate.governance.model.Approval;
import com.agentgate.governance.model.ApprovalCreateRequest;
import com.agentgate.governance.model.ApprovalDecisionRequest;
import com.agentgate.governance.model.ApprovalList;
import com.agentgate.governance.model.ApprovalStatus;
import com.agentgate.governance.model.EnforcementMode;
import com.agentgate.governance.repository.ApprovalRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Approval lifecycle: request, signed decision, single consumption.
 *
 * <p>Expiry is lazy. Nothing flips a record to expired on a timer; every path compares the
 * clock with {@code expiresAt} itself, and reads report the effective status.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    public static final int MAX_LIST_LIMIT = 100;
    public static final long MAX_TTL_SECONDS = 30L * 24 * 3600;

    private final ApprovalRepository approvalRepository;
    private final ApprovalSigner signer;
    private final GovernanceConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ApprovalService(ApprovalRepository approvalRepository, ApprovalSigner signer,
                           GovernanceConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.approvalRepository = approvalRepository;
        this.signer = signer;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void checkSecret() {
        if (config.hasHmacSecret()) return;
        if (config.getEnforcementMode() == EnforcementMode.STRICT) {
            throw new IllegalStateException("governance.hmac-secret must be set in strict enforcement mode");
        }
        log.warn("governance.hmac-secret is not set; approval decisions will be rejected");
    }

    public Approval request(ApprovalCreateRequest request) {
        requireText(request.getAgent(), "agent");
        requireText(request.getAction(), "action");
        requireText(request.getReason(), "reason");

        long ttlSeconds = request.getTtlSeconds() != null
                ? request.getTtlSeconds()
                : config.getDefaultApprovalTtlSeconds();
        if (ttlSeconds <= 0 || ttlSeconds > MAX_TTL_SECONDS) {
            throw new IllegalArgumentException(
                    "ttlSeconds must be between 1 and " + MAX_TTL_SECONDS + ", got: " + ttlSeconds);
        }

        // Whole seconds, so the signed timestamp has no fractional part.
        Instant requestedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Approval approval = Approval.builder()
                .id("apr_" + UUID.randomUUID().toString().replace("-", ""))
                .agent(request.getAgent())
                .action(request.getAction())
                .context(request.getContext() != null ? request.getContext() : new HashMap<>())
                .reason(request.getReason())
                .requestedBy(request.getRequestedBy())
                .policyRuleId(request.getPolicyRuleId())
                .status(ApprovalStatus.PENDING)
                .requestedAt(requestedAt)
                .expiresAt(requestedAt.plusSeconds(ttlSeconds))
                .build();

        approvalRepository.create(approval);
        metricsConfig.recordApprovalTransition(ApprovalStatus.PENDING);
        log.info("Approval requested: id={}, agent={}, action={}, expiresAt={}",
                approval.getId(), approval.getAgent(), approval.getAction(), approval.getExpiresAt());
        return approval;
    }

    /**
     * Apply a reviewer's signed decision. Checks run in order: existence, expiry, status,
     * signature; then a compare-and-set from pending.
     */
    public Approval decideApproval(String approvalId, ApprovalDecisionRequest request) {
        if (request.getDecision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        requireText(request.getApprover(), "approver");
        requireText(request.getSignature(), "signature");

        Approval approval = load(approvalId);
        Instant now = clock.instant();

        if (approval.isExpiredAt(now)) {
            if (approval.getStatus() == ApprovalStatus.PENDING && approvalRepository.markExpired(approvalId)) {
                metricsConfig.recordApprovalTransition(ApprovalStatus.EXPIRED);
            }
            log.warn("Decision on expired approval {} (expired at {})", approvalId, approval.getExpiresAt());
            throw new ApprovalExpiredException(approvalId, approval.getExpiresAt());
        }

        if (approval.getStatus() != ApprovalStatus.PENDING) {
            throw new ApprovalAlreadyDecidedException(approvalId, approval.getStatus());
        }

        if (!config.hasHmacSecret()) {
            log.warn("Rejecting decision on approval {}: no HMAC secret configured", approvalId);
            throw new ApprovalInvalidSignatureException(approvalId);
        }
        if (!signer.verify(approvalId, request.getDecision(), request.getApprover(),
                approval.getExpiresAt(), request.getSignature())) {
            log.warn("Invalid signature on approval {} from approver {}", approvalId, request.getApprover());
            throw new ApprovalInvalidSignatureException(approvalId);
        }

        boolean applied = approvalRepository.recordDecision(approvalId, request.getDecision(),
                request.getApprover(), request.getSignature(), request.getComment(), now);
        if (!applied) {
            metricsConfig.recordApprovalRaceLost("decide");
            Approval current = load(approvalId);
            log.warn("Lost decision race on approval {}; now {}", approvalId, current.getStatus());
            throw new ApprovalAlreadyDecidedException(approvalId, current.getStatus());
        }

        ApprovalStatus newStatus = request.getDecision().resultingStatus();
        metricsConfig.recordApprovalTransition(newStatus);
        log.info("Approval decided: id={}, decision={}, approver={}",
                approvalId, request.getDecision().getValue(), request.getApprover());
        return load(approvalId);
    }

    /**
     * Consume an approval: approved → executed, at most once. A second call fails.
     *
     * @throws ApprovalNotApprovedException if the approval is not approved, already executed, or expired
     */
    public Approval markExecuted(String approvalId) {
        Approval approval = load(approvalId);
        Instant now = clock.instant();

        ApprovalStatus effective = approval.effectiveStatus(now);
        if (effective != ApprovalStatus.APPROVED) {
            throw new ApprovalNotApprovedException(approvalId, effective);
        }

        if (!approvalRepository.markExecuted(approvalId, now)) {
            metricsConfig.recordApprovalRaceLost("execute");
            Approval current = load(approvalId);
            log.warn("Lost execution race on approval {}; now {}", approvalId, current.getStatus());
            throw new ApprovalNotApprovedException(approvalId, current.effectiveStatus(now));
        }

        metricsConfig.recordApprovalTransition(ApprovalStatus.EXECUTED);
        log.info("Approval executed: id={}, agent={}, action={}", approvalId, approval.getAgent(), approval.getAction());
        return load(approvalId);
    }

    /**
     * @return the approval with its effective status
     */
    public Approval get(String approvalId) {
        return withEffectiveStatus(load(approvalId), clock.instant());
    }

    public ApprovalList list(ApprovalStatus status, String agent, int limit, int offset) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }

        Instant now = clock.instant();
        List<Approval> forAgent = approvalRepository.findAll().stream()
                .filter(a -> agent == null || agent.equals(a.getAgent()))
                .map(a -> withEffectiveStatus(a, now))
                .sorted(Comparator.comparing(Approval::getRequestedAt).reversed()
                        .thenComparing(Approval::getId))
                .toList();

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ApprovalStatus s : ApprovalStatus.values()) {
            counts.put(s.getValue(), 0);
        }
        forAgent.forEach(a -> counts.merge(a.getStatus().getValue(), 1, Integer::sum));

        List<Approval> filtered = forAgent.stream()
                .filter(a -> status == null || a.getStatus() == status)
                .toList();
        List<Approval> page = filtered.stream()
                .skip(offset)
                .limit(limit)
                .toList();

        return new ApprovalList(page, filtered.size(), counts);
    }

    private Approval load(String approvalId) {
        return approvalRepository.findById(approvalId)
                .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
    }

    private static Approval withEffectiveStatus(Approval approval, Instant now) {
        ApprovalStatus effective = approval.effectiveStatus(now);
        if (effective == approval.getStatus()) return approval;
        return approval.toBuilder().status(effective).build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
