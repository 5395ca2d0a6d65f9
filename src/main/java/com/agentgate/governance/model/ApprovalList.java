package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "A page of approvals plus counts by effective status")
public record ApprovalList(List<Approval> approvals, int total, Map<String, Integer> counts) {}
