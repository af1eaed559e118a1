package io.github.chirino.access.mongo.model;

import io.quarkus.mongodb.panache.common.MongoEntity;
import java.time.Instant;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "role_memberships")
public class MongoRoleMembership {

    @BsonId public String id; // roleId:userId

    public String roleId;
    public String userId;
    public Instant joinedAt;
}
