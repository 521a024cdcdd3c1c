package com.advisor.chase.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.advisor.chase.config.AerospikeConfig;
import com.advisor.chase.exception.PersistenceUnavailableException;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.ChaseTarget;
import com.advisor.chase.model.ChaseType;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.Priority;
import com.advisor.chase.model.RiskLevel;
import com.advisor.chase.model.TargetKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class ChaseItemRepository {

    private static final Logger log = LoggerFactory.getLogger(ChaseItemRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public ChaseItemRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ChaseItem item) {
        Key key = new Key(namespace, AerospikeConfig.SET_CHASE_ITEMS, item.getId());
        ChaseTarget target = item.getTarget() != null ? item.getTarget() : new ChaseTarget();

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", item.getId()),
                new Bin("type", item.getType().name()),
                new Bin("status", item.getStatus().name()),
                new Bin("priority", item.getPriority().name()),
                new Bin("attempts", item.getAttempts()),
                new Bin("createdAt", item.getCreatedAt()),
                new Bin("lastActionAt", item.getLastActionAt()),
                new Bin("nextActionAt", item.getNextActionAt()),
                new Bin("firstContactAt", item.getFirstContactAt()),
                new Bin("resolvedAt", item.getResolvedAt()),
                new Bin("riskScore", item.getRiskScore()),
                new Bin("wentOverdue", item.isWentOverdue()),
                new Bin("history", serializeHistory(item.getHistory())),
                new Bin("version", item.getVersion())));

        addIfPresent(bins, "targetKind", target.getKind() != null ? target.getKind().name() : null);
        addIfPresent(bins, "targetId", target.getId());
        addIfPresent(bins, "targetName", target.getName());
        addIfPresent(bins, "targetEmail", target.getEmail());
        addIfPresent(bins, "targetPhone", target.getPhone());
        addIfPresent(bins, "riskLevel", item.getRiskLevel() != null ? item.getRiskLevel().name() : null);
        addIfPresent(bins, "providerRef", item.getProviderRef());
        addIfPresent(bins, "clientId", item.getClientId());
        addIfPresent(bins, "description", item.getDescription());
        addIfPresent(bins, "referenceNumber", item.getReferenceNumber());
        addIfPresent(bins, "channel", item.getChannel() != null ? item.getChannel().name() : null);
        addIfPresent(bins, "failureReason", item.getFailureReason() != null ? item.getFailureReason().name() : null);

        try {
            client.put(writePolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException("Failed to persist chase item " + item.getId(), e);
        }
    }

    /**
     * Full scan, used once at startup to hydrate the in-memory registry.
     */
    public List<ChaseItem> findAll() {
        List<ChaseItem> items = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CHASE_ITEMS,
                (key, record) -> {
                    try {
                        String id = record.getString("id");
                        if (id != null) {
                            synchronized (items) {
                                items.add(mapRecord(id, record));
                            }
                        }
                    } catch (RuntimeException e) {
                        log.warn("Failed to deserialize chase item record: {}", e.getMessage());
                    }
                });
        return items;
    }

    private ChaseItem mapRecord(String id, Record record) {
        ChaseTarget target = ChaseTarget.builder()
                .kind(parseEnum(TargetKind.class, record.getString("targetKind")))
                .id(record.getString("targetId"))
                .name(record.getString("targetName"))
                .email(record.getString("targetEmail"))
                .phone(record.getString("targetPhone"))
                .build();

        return ChaseItem.builder()
                .id(id)
                .target(target)
                .type(ChaseType.valueOf(record.getString("type")))
                .status(ChaseStatus.valueOf(record.getString("status")))
                .priority(Priority.valueOf(record.getString("priority")))
                .attempts(record.getInt("attempts"))
                .createdAt(record.getLong("createdAt"))
                .lastActionAt(record.getLong("lastActionAt"))
                .nextActionAt(record.getLong("nextActionAt"))
                .firstContactAt(record.getLong("firstContactAt"))
                .resolvedAt(record.getLong("resolvedAt"))
                .riskScore(record.getDouble("riskScore"))
                .wentOverdue(record.getBoolean("wentOverdue"))
                .riskLevel(parseEnum(RiskLevel.class, record.getString("riskLevel")))
                .providerRef(record.getString("providerRef"))
                .clientId(record.getString("clientId"))
                .description(record.getString("description"))
                .referenceNumber(record.getString("referenceNumber"))
                .channel(parseEnum(Channel.class, record.getString("channel")))
                .failureReason(parseEnum(ChaseErrorKind.class, record.getString("failureReason")))
                .history(deserializeHistory(record.getString("history")))
                .version(record.getLong("version"))
                .build();
    }

    private static void addIfPresent(List<Bin> bins, String name, String value) {
        if (value != null) {
            bins.add(new Bin(name, value));
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        return value == null ? null : Enum.valueOf(type, value);
    }

    private String serializeHistory(List<String> history) {
        try {
            return objectMapper.writeValueAsString(history != null ? history : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize chase item history", e);
        }
    }

    private List<String> deserializeHistory(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable chase item history, starting empty: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
