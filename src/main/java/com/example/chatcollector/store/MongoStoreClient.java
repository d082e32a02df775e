package com.example.chatcollector.store;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoStoreClient implements StoreClient {

    private final MongoTemplate mongo;

    public MongoStoreClient(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<Map<String, Object>> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, Integer limit) {
        Query q = new BasicQuery(new Document(filter == null ? Map.of() : filter));
        if (sort != null && !sort.isEmpty()) {
            List<Sort.Order> orders = sort.entrySet().stream()
                .map(e -> new Sort.Order(e.getValue() != null && e.getValue() < 0 ? Sort.Direction.DESC : Sort.Direction.ASC, e.getKey()))
                .collect(Collectors.toList());
            q.with(Sort.by(orders));
        }
        if (limit != null && limit > 0) q.limit(limit);
        List<Document> docs = mongo.find(q, Document.class, collection);
        List<Map<String, Object>> out = new ArrayList<>();
        for (Document d : docs) {
            d.remove("_id");
            out.add(d);
        }
        return out;
    }

    @Override
    public void appendEvent(String sessionId, Map<String, Object> event) {
        Document e = new Document(event);
        e.put("sessionId", sessionId);
        e.put("ts", new Date());
        mongo.insert(e, EVENTS);
    }
}
