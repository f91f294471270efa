package com.securehealth.store;

import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.securehealth.crypto.EncryptedValue;
import com.securehealth.exception.RecordNotFoundException;
import com.securehealth.exception.StoreUnavailableException;
import org.bson.BsonBinarySubType;
import org.bson.Document;
import org.bson.types.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Stores raw documents. Lookups and writes by {@code _id} go through the driver directly, so a
 * hex string id is matched as the string it was stored as and never mapped to an ObjectId.
 */
@Component
public class MongoDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);
    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void insert(String collection, Document document) {
        translate(collection, () -> this.mongoTemplate.insert(document, collection));
    }

    @Override
    public void replace(String collection, Document document) {
        Object id = document.get(ID);
        UpdateResult result = translate(collection, () -> this.mongoTemplate.execute(collection,
                mongoCollection -> mongoCollection.replaceOne(Filters.eq(ID, id), document)));
        if (result == null || result.getMatchedCount() == 0) {
            throw new RecordNotFoundException("No document " + id + " in " + collection);
        }
    }

    @Override
    public Optional<Document> findById(String collection, String id) {
        return Optional.ofNullable(translate(collection, () -> this.mongoTemplate.execute(collection,
                mongoCollection -> mongoCollection.find(Filters.eq(ID, id)).first())));
    }

    @Override
    public List<Document> findByField(String collection, String field, Object value, int limit) {
        Query query = new Query(Criteria.where(field).is(value)).limit(limit);
        return translate(collection, () -> this.mongoTemplate.find(query, Document.class, collection));
    }

    @Override
    public List<Document> findByRangeToken(String collection, String field, byte[] lower, byte[] upper, int limit) {
        String tokenPath = field + "." + EncryptedValue.ORDER_TOKEN_FIELD;
        Query query = new Query(Criteria.where(tokenPath)
                .gte(new Binary(BsonBinarySubType.BINARY, lower))
                .lte(new Binary(BsonBinarySubType.BINARY, upper)))
                .with(Sort.by(Sort.Direction.ASC, tokenPath))
                .limit(limit);
        return translate(collection, () -> this.mongoTemplate.find(query, Document.class, collection));
    }

    @Override
    public List<Document> findAll(String collection, int limit) {
        Query query = new Query().limit(limit);
        return translate(collection, () -> this.mongoTemplate.find(query, Document.class, collection));
    }

    @Override
    public boolean deleteById(String collection, String id) {
        DeleteResult result = translate(collection, () -> this.mongoTemplate.execute(collection,
                mongoCollection -> mongoCollection.deleteOne(Filters.eq(ID, id))));
        return result != null && result.getDeletedCount() > 0;
    }

    private <T> T translate(String collection, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.error("Document store unavailable for {}: {}", collection, e.getMessage());
            throw new StoreUnavailableException("Document store unavailable for " + collection, e);
        }
    }
}
