package com.advisor.chase.controller;

import com.advisor.chase.engine.agent.AgentRegistry;
import com.advisor.chase.model.AgentStatus;
import com.advisor.chase.service.ChaseOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Status of the chase agents and the orchestrator")
public class AgentController {

    private final AgentRegistry agentRegistry;
    private final ChaseOrchestrator orchestrator;

    public AgentController(AgentRegistry agentRegistry, ChaseOrchestrator orchestrator) {
        this.agentRegistry = agentRegistry;
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Get agent status",
            description = "Status (idle, busy or halted), last action and processed count for the orchestrator " +
                    "and each chase agent.")
    @GetMapping
    public ResponseEntity<List<AgentStatus>> getAgentStatus() {
        List<AgentStatus> statuses = new ArrayList<>();
        statuses.add(orchestrator.getStatus());
        statuses.addAll(agentRegistry.getStatuses());
        return ResponseEntity.ok(statuses);
    }

    @Operation(summary = "Resume the orchestrator",
            description = "Re-enables scheduling after it was halted by a persistence failure.")
    @PostMapping("/orchestrator/resume")
    public ResponseEntity<AgentStatus> resumeOrchestrator() {
        orchestrator.resume();
        return ResponseEntity.ok(orchestrator.getStatus());
    }
}
