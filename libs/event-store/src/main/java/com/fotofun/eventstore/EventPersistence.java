package com.fotofun.eventstore;

import com.fotofun.eventmodel.Event;

/**
 * Pluggable write-behind target for appended events and store snapshots.
 * <p>
 * Calls are made off the appending thread. Implementations may throw; the store logs
 * the failure and carries on.
 */
public interface EventPersistence {

    void persist(Event event) throws Exception;

    void persistSnapshot(StoreSnapshot snapshot) throws Exception;
}
