package com.example.songshare.persistence.repository;

import com.example.songshare.model.SongCounter;
import com.example.songshare.persistence.document.SongDocument;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.util.Assert;

import java.time.Instant;

@RequiredArgsConstructor
public class SongCounterOperationsImpl implements SongCounterOperations {

    private static final String TOTAL = "total";

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean incrementCounter(String slug, SongCounter counter, long delta) {
        Assert.hasText(slug, "slug required");
        Assert.notNull(counter, "counter required");
        Assert.isTrue(delta >= 0, "counters never decrease");

        Query query = Query.query(Criteria.where("slug").is(slug));
        Update update = new Update()
            .inc(counter.field(), delta)
            .set("updatedAt", Instant.now());
        UpdateResult result = mongoTemplate.updateFirst(query, update, SongDocument.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public long sumCounter(SongCounter counter) {
        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.group().sum(counter.field()).as(TOTAL)
        );
        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, SongDocument.class, Document.class);
        Document row = results.getUniqueMappedResult();
        if (row == null) {
            return 0L;
        }
        Object total = row.get(TOTAL);
        return total instanceof Number number ? number.longValue() : 0L;
    }
}
