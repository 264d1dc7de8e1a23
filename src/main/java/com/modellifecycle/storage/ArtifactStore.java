package com.modellifecycle.storage;

/**
 * Durable storage for trained model artifacts. Locations are opaque handles
 * returned by {@link #put(byte[])}.
 */
public interface ArtifactStore {

    String put(byte[] content);

    byte[] get(String location);

    void delete(String location);

    boolean exists(String location);
}
