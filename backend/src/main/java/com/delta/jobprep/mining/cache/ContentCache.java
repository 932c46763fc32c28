package com.delta.jobprep.mining.cache;

import java.util.Optional;

/**
 * URL-keyed store of serialized content snapshots. Writes for the same key are last-writer-wins.
 */
public interface ContentCache {

    Optional<byte[]> get(String url);

    void put(String url, byte[] payload);
}
