package com.agentgate.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.agentgate.governance.config.AerospikeConfig;
import com.agentgate.governance.model.Approval;
import com.agentgate.governance.model.ApprovalStatus;
import com.agentgate.governance.model.ApprovalVerdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Approval records. Every status change is a compare-and-set on the record generation,
 * so two racing writers produce exactly one winner.
 */
@Repository
public class ApprovalRepository {

    private static final Logger log = LoggerFactory.getLogger(ApprovalRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ApprovalRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void create(Approval approval) {
        Key key = key(approval.getId());
        WritePolicy createPolicy = new WritePolicy(writePolicy);
        createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(createPolicy, key,
                new Bin("id", approval.getId()),
                new Bin("agent", approval.getAgent()),
                new Bin("action", approval.getAction()),
                new Bin("context", serializeContext(approval.getContext())),
                new Bin("reason", approval.getReason()),
                new Bin("requestedBy", nullToEmpty(approval.getRequestedBy())),
                new Bin("policyRuleId", nullToEmpty(approval.getPolicyRuleId())),
                new Bin("status", approval.getStatus().name()),
                new Bin("requestedAt", approval.getRequestedAt().toEpochMilli()),
                new Bin("expiresAt", approval.getExpiresAt().toEpochMilli()),
                new Bin("decidedAt", 0L),
                new Bin("executedAt", 0L));
    }

    public Optional<Approval> findById(String id) {
        Record record = client.get(readPolicy, key(id));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    /**
     * Record the reviewer's decision, only if the row is still PENDING.
     * @return true if this call made the transition, false if the row was missing,
     *         no longer pending, or changed concurrently
     */
    public boolean recordDecision(String id, ApprovalVerdict verdict, String approver,
                                  String signature, String comment, Instant decidedAt) {
        return compareAndSet(id, ApprovalStatus.PENDING,
                new Bin("status", verdict.resultingStatus().name()),
                new Bin("decision", verdict.name()),
                new Bin("approver", approver),
                new Bin("signature", signature),
                new Bin("comment", nullToEmpty(comment)),
                new Bin("decidedAt", decidedAt.toEpochMilli()));
    }

    /**
     * APPROVED → EXECUTED. Succeeds for at most one caller per approval.
     */
    public boolean markExecuted(String id, Instant executedAt) {
        return compareAndSet(id, ApprovalStatus.APPROVED,
                new Bin("status", ApprovalStatus.EXECUTED.name()),
                new Bin("executedAt", executedAt.toEpochMilli()));
    }

    /**
     * PENDING → EXPIRED, written when a decision arrives too late.
     */
    public boolean markExpired(String id) {
        return compareAndSet(id, ApprovalStatus.PENDING,
                new Bin("status", ApprovalStatus.EXPIRED.name()));
    }

    public List<Approval> findAll() {
        List<Approval> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_APPROVALS,
                (key, record) -> {
                    try {
                        Approval approval = mapRecord(record);
                        synchronized (results) {
                            results.add(approval);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read approval record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private boolean compareAndSet(String id, ApprovalStatus expected, Bin... bins) {
        Key key = key(id);
        Record current = client.get(readPolicy, key);
        if (current == null) return false;

        String status = current.getString("status");
        if (!expected.name().equals(status)) {
            log.debug("Approval {} is {}, expected {}", id, status, expected);
            return false;
        }

        WritePolicy casPolicy = new WritePolicy(writePolicy);
        casPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        casPolicy.generation = current.generation;
        casPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        try {
            client.put(casPolicy, key, bins);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Lost concurrent update on approval {} (expected {})", id, expected);
                return false;
            }
            throw e;
        }
    }

    private Key key(String id) {
        return new Key(namespace, AerospikeConfig.SET_APPROVALS, id);
    }

    private Approval mapRecord(Record record) {
        String decision = emptyToNull(record.getString("decision"));
        return Approval.builder()
                .id(record.getString("id"))
                .agent(record.getString("agent"))
                .action(record.getString("action"))
                .context(deserializeContext(record.getString("context")))
                .reason(record.getString("reason"))
                .requestedBy(emptyToNull(record.getString("requestedBy")))
                .policyRuleId(emptyToNull(record.getString("policyRuleId")))
                .status(ApprovalStatus.valueOf(record.getString("status")))
                .requestedAt(Instant.ofEpochMilli(record.getLong("requestedAt")))
                .expiresAt(Instant.ofEpochMilli(record.getLong("expiresAt")))
                .decision(decision != null ? ApprovalVerdict.valueOf(decision) : null)
                .approver(emptyToNull(record.getString("approver")))
                .signature(emptyToNull(record.getString("signature")))
                .comment(emptyToNull(record.getString("comment")))
                .decidedAt(toInstant(record.getLong("decidedAt")))
                .executedAt(toInstant(record.getLong("executedAt")))
                .build();
    }

    private static Instant toInstant(long epochMillis) {
        return epochMillis > 0 ? Instant.ofEpochMilli(epochMillis) : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value != null && !value.isEmpty() ? value : null;
    }

    private String serializeContext(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context != null ? context : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Approval context is not serializable", e);
        }
    }

    private Map<String, Object> deserializeContext(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize approval context", e);
            return new HashMap<>();
        }
    }
}
