package com.delangzeta.realtime.ingestion.normalizer;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Looks up owners in collections written by the platform's CRUD side: submissions (contributor in
 * {@code userId}, contract hash in {@code idHash}) and crosschain_operations ({@code initiatorUserId}).
 */
@Component
@RequiredArgsConstructor
public class MongoCorrelationLookup implements CorrelationLookup {

    static final String SUBMISSIONS = "submissions";
    static final String CROSSCHAIN_OPERATIONS = "crosschain_operations";

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<String> findSubmissionOwner(String submissionIdOrHash) {
        if (submissionIdOrHash == null) {
            return Optional.empty();
        }
        Query query = new Query(new Criteria().orOperator(
                Criteria.where("_id").is(submissionIdOrHash),
                Criteria.where("idHash").is(submissionIdOrHash)));
        query.fields().include("userId");
        return Optional.ofNullable(mongoTemplate.findOne(query, Document.class, SUBMISSIONS))
                .map(d -> d.getString("userId"));
    }

    @Override
    public Optional<String> findOperationInitiator(String operationId) {
        if (operationId == null) {
            return Optional.empty();
        }
        Query query = new Query(Criteria.where("_id").is(operationId));
        query.fields().include("initiatorUserId");
        return Optional.ofNullable(mongoTemplate.findOne(query, Document.class, CROSSCHAIN_OPERATIONS))
                .map(d -> d.getString("initiatorUserId"));
    }
}
