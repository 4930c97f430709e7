package io.borgqueue.internal.mongo;

import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Objects;

/**
 * Monotonic integer ids from the {@code sequences} collection.
 *
 * <p>Each call is a single {@code findAndModify} with {@code $inc} and upsert, so concurrent
 * producers in different processes never receive the same value.
 */
public class MongoSequenceGenerator {

    public static final String JOBS_SEQUENCE = "jobs";

    private final MongoTemplate mongoTemplate;

    public MongoSequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public long next(String sequenceName) {
        Objects.requireNonNull(sequenceName, "sequenceName must not be null");

        SequenceDocument doc = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(sequenceName)),
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceDocument.class
        );
        if (doc == null) {
            throw new IllegalStateException("sequence " + sequenceName + " did not return a value");
        }
        return doc.getSeq();
    }
}
