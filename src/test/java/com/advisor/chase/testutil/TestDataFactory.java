package com.advisor.chase.testutil;

import com.advisor.chase.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final long DAY = 86_400_000L;
    public static final String CLIENT_ID = "CLIENT-001";

    private TestDataFactory() {}

    public static Client createClient(String clientId) {
        return Client.builder()
                .clientId(clientId)
                .name("Sarah Thompson")
                .email("sarah.thompson@example.com")
                .phone("+447700900456")
                .riskProfile("balanced")
                .build();
    }

    public static CreateChaseRequest documentRequest(String clientId, Priority priority) {
        return CreateChaseRequest.builder()
                .type(ChaseType.DOCUMENT)
                .target(ChaseTarget.builder().id(clientId).name("Sarah Thompson").build())
                .priority(priority)
                .clientId(clientId)
                .description("Latest P60")
                .build();
    }

    public static CreateChaseRequest loaRequest(String providerRef, Priority priority) {
        return CreateChaseRequest.builder()
                .type(ChaseType.LOA)
                .target(ChaseTarget.builder()
                        .id(providerRef)
                        .name(providerRef)
                        .email("loa@" + providerRef.toLowerCase().replace(' ', '-') + ".example")
                        .phone("+441234567890")
                        .build())
                .priority(priority)
                .providerRef(providerRef)
                .clientId(CLIENT_ID)
                .description("Pension LOA")
                .referenceNumber("REF-" + providerRef.hashCode())
                .build();
    }

    public static ChaseItem createItem(String id, ChaseType type, ChaseStatus status, Priority priority) {
        return ChaseItem.builder()
                .id(id)
                .target(ChaseTarget.builder()
                        .kind(type == ChaseType.LOA ? TargetKind.PROVIDER : TargetKind.CLIENT)
                        .id(type == ChaseType.LOA ? "Aviva" : CLIENT_ID)
                        .name(type == ChaseType.LOA ? "Aviva" : "Sarah Thompson")
                        .email(type == ChaseType.LOA ? "loa@aviva.example" : null)
                        .phone(type == ChaseType.LOA ? "+441234567890" : null)
                        .build())
                .type(type)
                .status(status)
                .priority(priority)
                .providerRef(type == ChaseType.LOA ? "Aviva" : null)
                .clientId(CLIENT_ID)
                .description("Latest P60")
                .referenceNumber("AV-778812")
                .createdAt(1_700_000_000_000L)
                .history(new ArrayList<>())
                .version(1)
                .build();
    }

    /**
     * Profile whose recent latencies all equal the mean, so the p90 spread factor is 1.
     */
    public static ProviderProfile createProfile(String providerId, double meanDays, long received, long failed) {
        long mean = Math.round(meanDays * DAY);
        List<Long> recent = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            recent.add(mean);
        }
        return ProviderProfile.builder()
                .providerId(providerId)
                .sampleCount(10)
                .ewmaLatencyMillis(mean)
                .recentLatencies(recent)
                .receivedCount(received)
                .failedCount(failed)
                .lastUpdated(1_700_000_000_000L)
                .build();
    }

    public static Activity createActivity(String itemId, ChaseStatus from, ChaseStatus to,
                                          ActivityOutcome outcome, long timestamp) {
        return Activity.builder()
                .id(itemId + "-" + timestamp + "-" + to)
                .itemId(itemId)
                .agentType(AgentType.DOCUMENT_CHASER)
                .action("reminder_sent")
                .fromStatus(from)
                .toStatus(to)
                .channel(Channel.EMAIL)
                .tone(Tone.FRIENDLY)
                .outcome(outcome)
                .attempts(1)
                .timestamp(timestamp)
                .build();
    }
}
