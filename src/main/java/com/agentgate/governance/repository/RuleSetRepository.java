package com.agentgate.governance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.agentgate.governance.config.AerospikeConfig;
import com.agentgate.governance.model.Budget;
import com.agentgate.governance.model.PolicyRule;
import com.agentgate.governance.model.RuleSetSnapshot;
import com.agentgate.governance.model.RuleSetVersion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists every accepted rule set under its own version record. The {@code active}
 * record holds only the version in force, so switching versions is one atomic write.
 */
@Repository
public class RuleSetRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleSetRepository.class);

    static final String ACTIVE_KEY = "active";
    static final String VERSION_KEY_PREFIX = "v";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public RuleSetRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return the snapshot the active pointer names, or empty when nothing was ever saved
     * @throws IllegalStateException if the pointer names a version record that does not exist
     */
    public Optional<RuleSetSnapshot> findActive() {
        Optional<Long> version = findActiveVersion();
        if (version.isEmpty()) return Optional.empty();

        return Optional.of(findVersion(version.get()).orElseThrow(() -> new IllegalStateException(
                "Active rule snapshot version " + version.get() + " is missing")));
    }

    public Optional<Long> findActiveVersion() {
        Record record = client.get(readPolicy, activeKey());
        if (record == null) return Optional.empty();
        return Optional.of(record.getLong("version"));
    }

    public Optional<RuleSetSnapshot> findVersion(long version) {
        Record record = client.get(readPolicy, versionKey(version));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    /**
     * Version history, newest first.
     */
    public List<RuleSetVersion> findAllVersions() {
        List<RuleSetVersion> versions = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_POLICY_SNAPSHOTS,
                (key, record) -> {
                    // The active pointer carries no rules bin.
                    if (record.getString("rules") == null) return;
                    try {
                        RuleSetSnapshot snapshot = mapRecord(record);
                        versions.add(new RuleSetVersion(snapshot.getVersion(), snapshot.getUpdatedAt(),
                                snapshot.getRules().size(), snapshot.getBudgets().size()));
                    } catch (Exception e) {
                        log.error("Failed to map rule snapshot record: {}", e.getMessage());
                    }
                });

        List<RuleSetVersion> sorted = new ArrayList<>(versions);
        sorted.sort(Comparator.comparingLong(RuleSetVersion::version).reversed());
        return sorted;
    }

    /**
     * Write the version record, then move the active pointer to it.
     */
    public void save(RuleSetSnapshot snapshot) {
        Bin versionBin = new Bin("version", snapshot.getVersion());
        Bin rulesBin = new Bin("rules", toJson(snapshot.getRules()));
        Bin budgetsBin = new Bin("budgets", toJson(snapshot.getBudgets()));
        Bin updatedAtBin = new Bin("updatedAt", snapshot.getUpdatedAt());
        client.put(writePolicy, versionKey(snapshot.getVersion()), versionBin, rulesBin, budgetsBin, updatedAtBin);

        client.put(writePolicy, activeKey(), new Bin("version", snapshot.getVersion()));
        log.debug("Persisted rule snapshot version {} ({} rules)", snapshot.getVersion(), snapshot.getRules().size());
    }

    private Key activeKey() {
        return new Key(namespace, AerospikeConfig.SET_POLICY_SNAPSHOTS, ACTIVE_KEY);
    }

    private Key versionKey(long version) {
        return new Key(namespace, AerospikeConfig.SET_POLICY_SNAPSHOTS, VERSION_KEY_PREFIX + version);
    }

    private RuleSetSnapshot mapRecord(Record record) {
        try {
            List<PolicyRule> rules = objectMapper.readValue(
                    record.getString("rules"), new TypeReference<List<PolicyRule>>() {});
            Map<String, Budget> budgets = objectMapper.readValue(
                    record.getString("budgets"), new TypeReference<Map<String, Budget>>() {});
            return RuleSetSnapshot.builder()
                    .version(record.getLong("version"))
                    .rules(rules)
                    .budgets(budgets)
                    .updatedAt(record.getLong("updatedAt"))
                    .build()
                    .frozen();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Persisted rule snapshot is not readable", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rule snapshot", e);
        }
    }
}
