package io.github.chirino.access.mongo.model;

import io.quarkus.mongodb.panache.common.MongoEntity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "organizations")
public class MongoOrganization {

    @BsonId public String id;

    public String name;
    public List<String> availableFeatures = new ArrayList<>();
    public Instant createdAt;
    public Instant deletedAt;
}
