package com.advisor.chase.service;

import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseItemFilter;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.ChaseTarget;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.CreateChaseRequest;
import com.advisor.chase.model.Priority;
import com.advisor.chase.model.TargetKind;
import com.advisor.chase.registry.ChaseItemRegistry;
import com.advisor.chase.registry.CommitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Chase item lifecycle operations that originate outside the orchestrator: initiation,
 * external responses and completion, and read-only queries.
 */
@Service
public class ChaseItemService {

    private static final Logger log = LoggerFactory.getLogger(ChaseItemService.class);

    private final ChaseItemRegistry registry;
    private final ProviderProfileService profileService;

    public ChaseItemService(ChaseItemRegistry registry, ProviderProfileService profileService) {
        this.registry = registry;
        this.profileService = profileService;
    }

    /**
     * @throws IllegalArgumentException when the request is incomplete
     */
    public ChaseItem create(CreateChaseRequest request) {
        if (request.getType() == null) {
            throw new IllegalArgumentException("type is required");
        }
        ChaseTarget target = request.getTarget();
        if (target == null || target.getId() == null || target.getId().isBlank()) {
            throw new IllegalArgumentException("target.id is required");
        }
        if (request.getType() == ChaseType.LOA && isBlank(request.getProviderRef())) {
            throw new IllegalArgumentException("providerRef is required for LOA chases");
        }

        TargetKind kind = request.getType() == ChaseType.LOA ? TargetKind.PROVIDER : TargetKind.CLIENT;
        ChaseTarget normalized = target.toBuilder()
                .kind(kind)
                .name(isBlank(target.getName()) ? target.getId() : target.getName())
                .build();
        String clientId = request.getClientId();
        if (isBlank(clientId) && kind == TargetKind.CLIENT) {
            clientId = target.getId();
        }

        ChaseItem draft = ChaseItem.builder()
                .target(normalized)
                .type(request.getType())
                .status(ChaseStatus.CREATED)
                .priority(request.getPriority() != null ? request.getPriority() : Priority.MEDIUM)
                .providerRef(request.getProviderRef())
                .clientId(clientId)
                .description(request.getDescription())
                .referenceNumber(request.getReferenceNumber())
                .build();
        return registry.register(draft);
    }

    public Optional<ChaseItem> get(String itemId) {
        return registry.get(itemId);
    }

    public List<ChaseItem> list(ChaseItemFilter filter) {
        return registry.find(filter);
    }

    public List<Activity> activities(String itemId) {
        return registry.activitiesFor(itemId);
    }

    /**
     * Record the response the item was waiting for. Idempotent: a repeat on a terminal
     * item returns it unchanged.
     *
     * @return empty when the item does not exist
     */
    public Optional<ChaseItem> markReceived(String itemId, String detail) {
        return resolve(itemId, ChaseStatus.RECEIVED, "response_received",
                detail != null ? detail : "Response received");
    }

    public Optional<ChaseItem> markCompleted(String itemId, String detail) {
        return resolve(itemId, ChaseStatus.COMPLETED, "completed",
                detail != null ? detail : "Marked complete");
    }

    private Optional<ChaseItem> resolve(String itemId, ChaseStatus target, String action, String detail) {
        Optional<CommitResult> result = registry.applyExternal(itemId, target, action, detail);
        result.filter(CommitResult::applied)
                .map(CommitResult::item)
                .ifPresent(item -> {
                    profileService.recordResolution(item);
                    log.debug("Recorded resolution latency for {} ({})", item.getId(), item.getProviderRef());
                });
        return result.map(CommitResult::item);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
