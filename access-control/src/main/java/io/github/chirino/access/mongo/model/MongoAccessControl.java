package io.github.chirino.access.mongo.model;

import io.quarkus.mongodb.panache.common.MongoEntity;
import java.time.Instant;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "access_controls")
public class MongoAccessControl {

    @BsonId public String id;

    public String teamId;
    public String resource;
    public String resourceId;
    public String organizationMemberId;
    public String roleId;
    public String accessLevel;
    public String createdBy;
    public Instant createdAt;
    public Instant updatedAt;
}
