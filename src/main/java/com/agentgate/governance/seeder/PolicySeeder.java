package com.agentgate.governance.seeder;

import com.agentgate.governance.engine.RuleStore;
import com.agentgate.governance.model.RuleSetRequest;
import com.agentgate.governance.model.RuleSetUpdateResult;
import com.agentgate.governance.repository.RuleSetRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.InputStream;

/**
 * Installs the default policy set when no rule snapshot has been persisted yet.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Defaults cover inbox triage, knowledge updates, insights, warehouse health, global
 * read-only allows and destructive-action denials.
 */
@Component
@Profile("seed")
public class PolicySeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PolicySeeder.class);

    static final String DEFAULT_RULES = "policy/default-rules.json";

    private final RuleSetRepository ruleSetRepository;
    private final RuleStore ruleStore;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PolicySeeder(RuleSetRepository ruleSetRepository, RuleStore ruleStore) {
        this.ruleSetRepository = ruleSetRepository;
        this.ruleStore = ruleStore;
    }

    @Override
    public void run(String... args) throws Exception {
        if (ruleSetRepository.findActive().isPresent()) {
            log.info("Rule snapshot already persisted, skipping policy seeding");
            return;
        }

        log.info("=== Seeding default policies from {} ===", DEFAULT_RULES);
        RuleSetRequest defaults;
        try (InputStream in = new ClassPathResource(DEFAULT_RULES).getInputStream()) {
            defaults = objectMapper.readValue(in, RuleSetRequest.class);
        }

        RuleSetUpdateResult result = ruleStore.replace(defaults.rules(), defaults.budgets());
        result.lint().getWarnings().forEach(w -> log.info("Seed lint warning: {}", w.message()));
        log.info("=== Seeded {} rules and {} budgets (version {}) ===",
                result.snapshot().getRules().size(), result.snapshot().getBudgets().size(),
                result.snapshot().getVersion());
    }
}
