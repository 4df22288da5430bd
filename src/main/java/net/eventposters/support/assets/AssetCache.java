package net.eventposters.support.assets;

import java.util.Optional;

/**
 * Asset lookup that may fetch missing assets on first use.
 *
 * <p>Contract: at most one fetch runs per key. Concurrent callers asking for a key
 * that is being fetched wait for that fetch and reuse its bytes; later callers get
 * the cached bytes. Failed fetches are not cached, the next caller tries again.
 */
public interface AssetCache {

    /**
     * @return a private copy of the asset bytes, or empty when the asset is unavailable
     */
    Optional<byte[]> getOrFetch(String logicalName);
}
