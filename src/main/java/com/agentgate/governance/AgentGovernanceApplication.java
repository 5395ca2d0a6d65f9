package com.agentgate.governance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentGovernanceApplication.class, args);
    }
}
