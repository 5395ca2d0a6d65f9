package com.agentgate.governance.engine;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.config.MetricsConfig;
import com.agentgate.governance.exception.InvalidRuleSetException;
import com.agentgate.governance.exception.RuleSetVersionNotFoundException;
import com.agentgate.governance.model.Budget;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.LintReport;
import com.agentgate.governance.model.PolicyRule;
import com.agentgate.governance.model.RuleSetSnapshot;
import com.agentgate.governance.model.RuleSetUpdateResult;
import com.agentgate.governance.model.RuleSetVersion;
import com.agentgate.governance.repository.RuleSetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule snapshot behind an atomic reference. Readers take whatever
 * snapshot is current when they start and keep it to completion; replacement swaps
 * in a fully built snapshot.
 */
@Component
public class RuleStore {

    private static final Logger log = LoggerFactory.getLogger(RuleStore.class);

    private final AtomicReference<RuleSetSnapshot> current = new AtomicReference<>(RuleSetSnapshot.empty());

    private final RuleSetRepository repository;
    private final RuleSetLinter linter;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final Effect defaultEffect;

    public RuleStore(RuleSetRepository repository, RuleSetLinter linter, MetricsConfig metricsConfig,
                     Clock clock, GovernanceConfig config) {
        if (config.getDefaultEffect() == null || config.getDefaultEffect() == Effect.NEEDS_APPROVAL) {
            throw new IllegalStateException(
                    "governance.default-effect must be allow or deny, got: " + config.getDefaultEffect());
        }
        this.repository = repository;
        this.linter = linter;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.defaultEffect = config.getDefaultEffect();
    }

    public RuleSetSnapshot current() {
        return current.get();
    }

    public Effect getDefaultEffect() {
        return defaultEffect;
    }

    /**
     * Lint, persist and install a new rule set. Nothing changes if lint reports errors.
     *
     * @throws InvalidRuleSetException if the rule set has lint errors
     */
    public synchronized RuleSetUpdateResult replace(List<PolicyRule> rules, Map<String, Budget> budgets) {
        List<PolicyRule> newRules = rules != null ? rules : List.of();
        Map<String, Budget> newBudgets = budgets != null ? budgets : Map.of();

        LintReport report = linter.lint(newRules, newBudgets);
        if (report.hasErrors()) {
            log.warn("Rejected rule set with {} lint error(s)", report.getErrors().size());
            throw new InvalidRuleSetException(report);
        }

        // Another node may have installed a newer version since our last refresh.
        long base = Math.max(current.get().getVersion(), repository.findActiveVersion().orElse(0L));
        RuleSetSnapshot snapshot = RuleSetSnapshot.builder()
                .version(base + 1)
                .rules(newRules)
                .budgets(newBudgets)
                .updatedAt(clock.millis())
                .build()
                .frozen();

        repository.save(snapshot);
        install(snapshot);
        log.info("Rule snapshot replaced: version={}, rules={}, budgets={}, warnings={}",
                snapshot.getVersion(), snapshot.getRules().size(), snapshot.getBudgets().size(),
                report.getWarnings().size());
        return new RuleSetUpdateResult(snapshot, report);
    }

    /**
     * @throws RuleSetVersionNotFoundException if that version was never persisted
     */
    public RuleSetSnapshot snapshotAt(long version) {
        if (version == current.get().getVersion() && version > 0) {
            return current.get();
        }
        return repository.findVersion(version).orElseThrow(() -> new RuleSetVersionNotFoundException(version));
    }

    public List<RuleSetVersion> versions() {
        return repository.findAllVersions();
    }

    /**
     * Re-install the content of an earlier version as a new version. History is never rewritten.
     *
     * @throws RuleSetVersionNotFoundException if that version was never persisted
     */
    public synchronized RuleSetUpdateResult rollback(long version) {
        RuleSetSnapshot target = repository.findVersion(version)
                .orElseThrow(() -> new RuleSetVersionNotFoundException(version));
        long from = current.get().getVersion();
        RuleSetUpdateResult result = replace(target.getRules(), target.getBudgets());
        log.warn("Rule snapshot rolled back: from version {} to content of version {}, now version {}",
                from, version, result.snapshot().getVersion());
        return result;
    }

    /**
     * Start periodic reload from the store so every node converges on the persisted snapshot.
     */
    public void startRefresh(int intervalSeconds) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rule-snapshot-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refresh, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void refresh() {
        try {
            Optional<RuleSetSnapshot> persisted = repository.findActive();
            if (persisted.isEmpty()) {
                log.debug("No persisted rule snapshot, keeping version {}", current.get().getVersion());
                return;
            }
            RuleSetSnapshot loaded = persisted.get();
            RuleSetSnapshot active = current.get();
            if (loaded.getVersion() != active.getVersion() || loaded.getUpdatedAt() != active.getUpdatedAt()) {
                install(loaded);
                log.info("Rule snapshot reloaded: version={}, rules={}", loaded.getVersion(), loaded.getRules().size());
            }
        } catch (Exception e) {
            log.error("Failed to refresh rule snapshot", e);
        }
    }

    private void install(RuleSetSnapshot snapshot) {
        current.set(snapshot);
        metricsConfig.updateActiveRuleCount(snapshot.getRules().size());
    }
}
