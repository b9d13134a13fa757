package com.bank.aml.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.aml.config.AerospikeConfig;
import com.bank.aml.model.PipelineResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Stores pipeline results keyed by transaction id. Scalar fields get their own
 * bins for ad-hoc queries; the full result is kept as JSON.
 */
@Repository
public class PipelineResultRepository {

    private static final Logger log = LoggerFactory.getLogger(PipelineResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public PipelineResultRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy,
                                    ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * @return true when the result was written
     */
    public boolean save(PipelineResult result) {
        Key key = new Key(namespace, AerospikeConfig.SET_PIPELINE_RESULTS, result.getTransactionId());
        try {
            client.put(writePolicy, key,
                    new Bin("txnId", result.getTransactionId()),
                    new Bin("decision", result.getFinalDecision().name()),
                    new Bin("confidence", result.getFinalConfidence()),
                    new Bin("exitLayer", result.getExitLayer().getLabel()),
                    new Bin("evaluatedAt", result.getEvaluatedAt()),
                    new Bin("result", objectMapper.writeValueAsString(result)));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize pipeline result for txn {}", result.getTransactionId(), e);
        } catch (AerospikeException e) {
            log.error("Failed to store pipeline result for txn {}: {}", result.getTransactionId(), e.getMessage(), e);
        }
        return false;
    }

    public Optional<PipelineResult> findByTxnId(String txnId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PIPELINE_RESULTS, txnId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return Optional.empty();
        }
        String json = record.getString("result");
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PipelineResult.class));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize pipeline result for txn {}", txnId, e);
            return Optional.empty();
        }
    }
}
