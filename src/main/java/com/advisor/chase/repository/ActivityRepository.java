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
import com.advisor.chase.model.Activity;
import com.advisor.chase.model.ActivityOutcome;
import com.advisor.chase.model.AgentType;
import com.advisor.chase.model.ChaseErrorKind;
import com.advisor.chase.model.ChaseStatus;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.Tone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Write-through store of the activity log. Records are never updated once written.
 */
@Repository
public class ActivityRepository {

    private static final Logger log = LoggerFactory.getLogger(ActivityRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public ActivityRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void saveAll(List<Activity> activities) {
        for (Activity activity : activities) {
            save(activity);
        }
    }

    public void save(Activity activity) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACTIVITIES, activity.getId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", activity.getId()),
                new Bin("itemId", activity.getItemId()),
                new Bin("agentType", activity.getAgentType().name()),
                new Bin("action", activity.getAction()),
                new Bin("outcome", activity.getOutcome().name()),
                new Bin("attempts", activity.getAttempts()),
                new Bin("riskScore", activity.getRiskScore()),
                new Bin("leaseSeq", activity.getLeaseSeq()),
                new Bin("timestamp", activity.getTimestamp())));

        if (activity.getFromStatus() != null) bins.add(new Bin("fromStatus", activity.getFromStatus().name()));
        if (activity.getToStatus() != null) bins.add(new Bin("toStatus", activity.getToStatus().name()));
        if (activity.getChannel() != null) bins.add(new Bin("channel", activity.getChannel().name()));
        if (activity.getTone() != null) bins.add(new Bin("tone", activity.getTone().name()));
        if (activity.getErrorKind() != null) bins.add(new Bin("errorKind", activity.getErrorKind().name()));
        if (activity.getDetail() != null) bins.add(new Bin("detail", activity.getDetail()));

        try {
            client.put(writePolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException("Failed to persist activity " + activity.getId(), e);
        }
    }

    /**
     * All stored activities in timestamp order, used to hydrate the in-memory log.
     */
    public List<Activity> findAll() {
        List<Activity> activities = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACTIVITIES,
                (key, record) -> {
                    try {
                        if (record.getString("id") != null) {
                            synchronized (activities) {
                                activities.add(mapRecord(record));
                            }
                        }
                    } catch (RuntimeException e) {
                        log.warn("Failed to deserialize activity record: {}", e.getMessage());
                    }
                });
        activities.sort(Comparator.comparingLong(Activity::getTimestamp));
        return activities;
    }

    private Activity mapRecord(Record record) {
        return Activity.builder()
                .id(record.getString("id"))
                .itemId(record.getString("itemId"))
                .agentType(AgentType.valueOf(record.getString("agentType")))
                .action(record.getString("action"))
                .fromStatus(parse(ChaseStatus.class, record.getString("fromStatus")))
                .toStatus(parse(ChaseStatus.class, record.getString("toStatus")))
                .channel(parse(Channel.class, record.getString("channel")))
                .tone(parse(Tone.class, record.getString("tone")))
                .outcome(ActivityOutcome.valueOf(record.getString("outcome")))
                .errorKind(parse(ChaseErrorKind.class, record.getString("errorKind")))
                .detail(record.getString("detail"))
                .attempts(record.getInt("attempts"))
                .riskScore(record.getDouble("riskScore"))
                .leaseSeq(record.getLong("leaseSeq"))
                .timestamp(record.getLong("timestamp"))
                .build();
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        return value == null ? null : Enum.valueOf(type, value);
    }
}
