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
import com.advisor.chase.model.Client;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Client directory consulted by the document chaser. Stands in for the advisor's CRM.
 */
@Repository
public class ClientRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ClientRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public Client findByClientId(String clientId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLIENTS, clientId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException("Failed to read client " + clientId, e);
        }
        if (record == null) return null;
        return Client.builder()
                .clientId(clientId)
                .name(record.getString("name"))
                .email(record.getString("email"))
                .phone(record.getString("phone"))
                .riskProfile(record.getString("riskProfile"))
                .build();
    }

    public void save(Client c) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLIENTS, c.getClientId());
        try {
            client.put(writePolicy, key,
                    new Bin("clientId", c.getClientId()),
                    new Bin("name", c.getName()),
                    new Bin("email", c.getEmail()),
                    new Bin("phone", c.getPhone()),
                    new Bin("riskProfile", c.getRiskProfile()));
        } catch (AerospikeException e) {
            throw new PersistenceUnavailableException("Failed to persist client " + c.getClientId(), e);
        }
    }
}
