package com.delangzeta.realtime.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.List;

@RequiredArgsConstructor
public class CanonicalEventRepositoryImpl implements CanonicalEventRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<CanonicalEvent> findChainHistory(String eventName, Long fromBlock, Long toBlock, int limit) {
        List<Criteria> criteria = new ArrayList<>();
        criteria.add(Criteria.where("transactionHash").exists(true));
        if (eventName != null && !eventName.isBlank()) {
            criteria.add(Criteria.where("eventName").is(eventName));
        }
        if (fromBlock != null || toBlock != null) {
            Criteria block = Criteria.where("blockNumber");
            if (fromBlock != null) {
                block = block.gte(fromBlock);
            }
            if (toBlock != null) {
                block = block.lte(toBlock);
            }
            criteria.add(block);
        }
        Query query = new Query(new Criteria().andOperator(criteria))
                .with(Sort.by(Sort.Order.desc("blockNumber"), Sort.Order.desc("logIndex")))
                .limit(limit);
        return mongoTemplate.find(query, CanonicalEvent.class);
    }

    @Override
    public boolean markPublished(String id) {
        UpdateResult result = mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(id)),
                new Update().set("published", true), CanonicalEvent.class);
        return result.getMatchedCount() > 0;
    }
}
