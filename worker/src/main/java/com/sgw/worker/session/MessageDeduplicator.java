package com.sgw.worker.session;

import it.unimi.dsi.fastutil.objects.Object2LongLinkedOpenHashMap;

/**
 * Remembers message ids seen within a trailing window to absorb redelivery.
 * Insertion-ordered, so expiry only ever looks at the head. Not thread-safe.
 */
public final class MessageDeduplicator {

    private final long windowMs;
    private final int  maxEntries;
    private final Object2LongLinkedOpenHashMap<String> seen = new Object2LongLinkedOpenHashMap<>();

    public MessageDeduplicator(long windowMs, int maxEntries) {
        this.windowMs   = windowMs;
        this.maxEntries = maxEntries;
    }

    /** @return true the first time {@code messageId} is seen within the window */
    public boolean firstSeen(String messageId, long nowMs) {
        evict(nowMs);
        if (seen.containsKey(messageId)) return false;
        seen.put(messageId, nowMs);
        return true;
    }

    public int size() { return seen.size(); }

    private void evict(long nowMs) {
        while (!seen.isEmpty()) {
            String oldest = seen.firstKey();
            if (nowMs - seen.getLong(oldest) > windowMs || seen.size() >= maxEntries) {
                seen.removeFirstLong();
            } else {
                break;
            }
        }
    }
}
