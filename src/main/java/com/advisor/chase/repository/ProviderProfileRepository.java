package com.advisor.chase.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.advisor.chase.config.AerospikeConfig;
import com.advisor.chase.exception.PersistenceUnavailableException;
import com.advisor.chase.model.ProviderProfile;
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
public class ProviderProfileRepository {

    private static final Logger log = LoggerFactory.getLogger(ProviderProfileRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ProviderProfileRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public ProviderProfile findByProviderId(String providerId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PROVIDER_PROFILES, providerId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException("Failed to read provider profile " + providerId, e);
        }
        if (record == null) {
            return null;
        }
        return ProviderProfile.builder()
                .providerId(providerId)
                .sampleCount(record.getLong("sampleCount"))
                .ewmaLatencyMillis(record.getDouble("ewmaLatency"))
                .recentLatencies(deserializeLatencies(record.getString("recentLatency")))
                .receivedCount(record.getLong("receivedCount"))
                .failedCount(record.getLong("failedCount"))
                .overdueCount(record.getLong("overdueCount"))
                .lastUpdated(record.getLong("lastUpdated"))
                .build();
    }

    public void save(ProviderProfile profile) {
        Key key = new Key(namespace, AerospikeConfig.SET_PROVIDER_PROFILES, profile.getProviderId());

        Bin providerIdBin = new Bin("providerId", profile.getProviderId());
        Bin sampleCountBin = new Bin("sampleCount", profile.getSampleCount());
        Bin ewmaLatencyBin = new Bin("ewmaLatency", profile.getEwmaLatencyMillis());
        Bin recentBin = new Bin("recentLatency", serializeLatencies(profile.getRecentLatencies()));
        Bin receivedBin = new Bin("receivedCount", profile.getReceivedCount());
        Bin failedBin = new Bin("failedCount", profile.getFailedCount());
        Bin overdueBin = new Bin("overdueCount", profile.getOverdueCount());
        Bin lastUpdatedBin = new Bin("lastUpdated", profile.getLastUpdated());

        try {
            client.put(writePolicy, key,
                    providerIdBin, sampleCountBin, ewmaLatencyBin, recentBin,
                    receivedBin, failedBin, overdueBin, lastUpdatedBin);
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException(
                    "Failed to persist provider profile " + profile.getProviderId(), e);
        }
    }

    private String serializeLatencies(List<Long> latencies) {
        try {
            return objectMapper.writeValueAsString(latencies != null ? latencies : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize provider latencies", e);
        }
    }

    private List<Long> deserializeLatencies(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<Long>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable latency window, starting empty: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
