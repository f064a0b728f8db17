package com.planningpoker.model;

import java.time.Instant;

/**
 * A connected participant of a voting session.
 */
public class Participant {
    public final String id;
    public final String name;
    public final Instant joinedAt;

    public Participant(String id, String name, Instant joinedAt) {
        this.id = id;
        this.name = name;
        this.joinedAt = joinedAt;
    }

    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                '}';
    }
}
