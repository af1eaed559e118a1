package io.github.chirino.access.mongo.model;

import io.quarkus.mongodb.panache.common.MongoEntity;
import java.time.Instant;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "organization_memberships")
public class MongoOrganizationMembership {

    @BsonId public String id;

    public String organizationId;
    public String userId;
    public int level;
    public Instant createdAt;
}
