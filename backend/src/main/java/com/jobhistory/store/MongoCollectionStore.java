package com.jobhistory.store;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed store: one MongoDB collection per store collection, object key in {@code _id}.
 * Documents are read and written as raw BSON so fields this service does not know survive untouched.
 */
@RequiredArgsConstructor
public class MongoCollectionStore implements CollectionStore {

    private static final String ID_FIELD = "_id";

    private final MongoTemplate mongoTemplate;

    @Override
    public Map<String, Object> fetch(String collection, String key) {
        Document doc;
        try {
            doc = mongoTemplate.findById(key, Document.class, collection);
        } catch (DataAccessException e) {
            throw new StoreException("failed to fetch " + collection + "/" + key + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new RecordNotFoundException(collection, key);
        }
        Map<String, Object> result = new LinkedHashMap<>(doc);
        result.remove(ID_FIELD);
        return result;
    }

    @Override
    public void put(String collection, String key, Map<String, Object> document) {
        Document doc = new Document(document);
        doc.put(ID_FIELD, key);
        try {
            mongoTemplate.save(doc, collection);
        } catch (DataAccessException e) {
            throw new StoreException("failed to save " + collection + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> searchKeys(String collection, StoreFilter filter) {
        Query query = new Query(where(filter.field()).is(filter.value()));
        query.fields().include(ID_FIELD);
        try {
            return mongoTemplate.find(query, Document.class, collection).stream()
                    .map(d -> String.valueOf(d.get(ID_FIELD)))
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreException("failed to search " + collection + " by " + filter.toExpression()
                    + ": " + e.getMessage(), e);
        }
    }
}
