/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.imagebuf.cache;

/**
 * Tile cache statistics.
 *
 * @param hitCount tile requests served from the cache
 * @param missCount tile requests that loaded the tile
 * @param loadCount tile loads attempted
 * @param evictionCount tiles evicted
 * @param tileCount tiles currently cached
 * @param fileCount images currently open
 * @param estimatedSizeBytes pixel bytes held by cached tiles
 * @param outstandingTiles tile references handed out and not yet released
 * @param hitRate hits over requests, between 0.0 and 1.0
 * @param averageLoadTime mean tile load time, in nanoseconds
 */
public record ImageCacheStats(
        long hitCount,
        long missCount,
        long loadCount,
        long evictionCount,
        long tileCount,
        long fileCount,
        long estimatedSizeBytes,
        long outstandingTiles,
        double hitRate,
        double averageLoadTime) {

    static ImageCacheStats fromCaffeine(
            com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats,
            long tileCount,
            long fileCount,
            long estimatedSizeBytes,
            long outstandingTiles) {
        return new ImageCacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.loadCount(),
                caffeineStats.evictionCount(),
                tileCount,
                fileCount,
                estimatedSizeBytes,
                outstandingTiles,
                caffeineStats.hitRate(),
                caffeineStats.averageLoadPenalty());
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    @Override
    public String toString() {
        return String.format(
                "ImageCacheStats{files=%d, tiles=%d, sizeBytes=%d, outstanding=%d, hitRate=%.2f%%, hits=%d, misses=%d, evictions=%d}",
                fileCount,
                tileCount,
                estimatedSizeBytes,
                outstandingTiles,
                hitRate * 100.0,
                hitCount,
                missCount,
                evictionCount);
    }
}
