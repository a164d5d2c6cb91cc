package com.acme.users.domain;

import com.acme.commanding.domain.AggregateRoot;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * Aggregate root for User
 */
@Getter
public class User implements AggregateRoot {
    private final String userId;
    private String name;
    private int version;

    public User(String userId, String name) {
        this(userId, name, 0);
    }

    @JsonCreator
    private User(
            @JsonProperty("userId") String userId,
            @JsonProperty("name") String name,
            @JsonProperty("version") int version) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        this.userId = userId;
        this.name = requireName(name);
        this.version = version;
    }

    public void rename(String newName) {
        this.name = requireName(newName);
        this.version++;
    }

    @Override
    public String uniqueId() {
        return userId;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("User name cannot be null or blank");
        }
        return name;
    }
}
