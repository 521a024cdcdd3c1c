package com.advisor.chase.controller;

import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseItemFilter;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.CreateChaseRequest;
import com.advisor.chase.model.Priority;
import com.advisor.chase.model.ProcessOutcome;
import com.advisor.chase.service.ChaseItemService;
import com.advisor.chase.service.ChaseOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/chase-items")
@Tag(name = "Chase Items", description = "Initiate, inspect and resolve document and LOA chases")
public class ChaseItemController {

    private final ChaseItemService chaseItemService;
    private final ChaseOrchestrator orchestrator;

    public ChaseItemController(ChaseItemService chaseItemService, ChaseOrchestrator orchestrator) {
        this.chaseItemService = chaseItemService;
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "List chase items",
            description = "Newest first. All filters are optional; dueOnly restricts to non-terminal items " +
                    "whose next action time has been reached.")
    @GetMapping
    public ResponseEntity<List<ChaseItem>> listChaseItems(
            @RequestParam(required = false) ChaseStatus status,
            @RequestParam(required = false) ChaseType type,
            @RequestParam(required = false) Priority priority,
            @RequestParam(required = false) String clientId,
            @RequestParam(defaultValue = "false") boolean dueOnly,
            @Parameter(description = "Maximum items to return (1-1000)", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        ChaseItemFilter filter = ChaseItemFilter.builder()
                .status(status)
                .type(type)
                .priority(priority)
                .clientId(clientId)
                .dueOnly(dueOnly)
                .limit(Math.max(1, Math.min(limit, 1000)))
                .build();
        return ResponseEntity.ok(chaseItemService.list(filter));
    }

    @Operation(summary = "Get a chase item")
    @GetMapping("/{itemId}")
    public ResponseEntity<ChaseItem> getChaseItem(
            @Parameter(description = "Chase item ID", example = "CHASE-3f1c2a9b")
            @PathVariable String itemId) {
        return chaseItemService.get(itemId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Get the activity history of a chase item", description = "Oldest first.")
    @GetMapping("/{itemId}/activities")
    public ResponseEntity<List<Activity>> getActivities(@PathVariable String itemId) {
        if (chaseItemService.get(itemId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(chaseItemService.activities(itemId));
    }

    @Operation(summary = "Start chasing a document or LOA",
            description = "Registers the item as PENDING; the first communication goes out on the next tick " +
                    "or immediately via the process endpoint.")
    @PostMapping
    public ResponseEntity<ChaseItem> createChaseItem(@RequestBody CreateChaseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(chaseItemService.create(request));
    }

    @Operation(summary = "Process a chase item now",
            description = "Evaluates the item immediately under the same exclusive lease as the scheduler. " +
                    "Returns SKIPPED_LEASED when a worker is already processing it.")
    @PostMapping("/{itemId}/process")
    public ResponseEntity<ProcessOutcome> processNow(@PathVariable String itemId) {
        ProcessOutcome outcome = orchestrator.processNow(itemId);
        if (outcome.getResult() == ProcessOutcome.Result.NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(outcome);
    }

    @Operation(summary = "Record the response a chase was waiting for",
            description = "Moves the item to RECEIVED. Repeating it on a resolved item returns the item unchanged.")
    @PostMapping("/{itemId}/received")
    public ResponseEntity<ChaseItem> markReceived(@PathVariable String itemId,
                                                  @RequestBody(required = false) Map<String, String> body) {
        return chaseItemService.markReceived(itemId, body != null ? body.get("detail") : null)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Complete or cancel a chase", description = "Moves any non-terminal item to COMPLETED.")
    @PostMapping("/{itemId}/complete")
    public ResponseEntity<ChaseItem> markCompleted(@PathVariable String itemId,
                                                   @RequestBody(required = false) Map<String, String> body) {
        return chaseItemService.markCompleted(itemId, body != null ? body.get("detail") : null)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
