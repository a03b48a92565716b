package com.sgw.gateway.route;

import com.sgw.common.SessionPartitioner;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session id to owning worker index.
 *
 * Claimed sessions resolve to their owner. Unclaimed ones fall back to
 * {@link SessionPartitioner#partition}, so concurrent first requests for the same id
 * converge on one worker before any claim exists.
 *
 * Single writer: only the coordinator loop touches this, in response to worker
 * claim/release signals and worker exits. Not thread-safe.
 */
public final class OwnershipDirectory {

    private static final Logger log = LoggerFactory.getLogger(OwnershipDirectory.class);

    public static final int UNCLAIMED = -1;

    private final int workerCount;
    private final Object2IntOpenHashMap<String> owners = new Object2IntOpenHashMap<>();

    public OwnershipDirectory(int workerCount) {
        if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        this.workerCount = workerCount;
        owners.defaultReturnValue(UNCLAIMED);
    }

    public int resolve(String sessionId) {
        int owner = owners.getInt(sessionId);
        return owner != UNCLAIMED ? owner : SessionPartitioner.partition(sessionId, workerCount);
    }

    /** @return the claimed owner, or {@link #UNCLAIMED} */
    public int owner(String sessionId) {
        return owners.getInt(sessionId);
    }

    /** Idempotent upsert. */
    public void claim(String sessionId, int workerIndex) {
        checkIndex(workerIndex);
        int previous = owners.put(sessionId, workerIndex);
        if (previous != UNCLAIMED && previous != workerIndex) {
            log.warn("[{}] ownership moved from worker {} to {}", sessionId, previous, workerIndex);
        }
    }

    /**
     * Releases only if {@code workerIndex} still owns the session, so a late release from
     * a former owner cannot drop a newer claim.
     */
    public boolean release(String sessionId, int workerIndex) {
        if (owners.getInt(sessionId) != workerIndex) return false;
        owners.removeInt(sessionId);
        return true;
    }

    /** Drops every record pointing at a dead worker. */
    public int releaseAll(int workerIndex) {
        int released = 0;
        ObjectIterator<Object2IntMap.Entry<String>> it = owners.object2IntEntrySet().fastIterator();
        while (it.hasNext()) {
            if (it.next().getIntValue() == workerIndex) {
                it.remove();
                released++;
            }
        }
        return released;
    }

    public int size() { return owners.size(); }

    private void checkIndex(int workerIndex) {
        if (workerIndex < 0 || workerIndex >= workerCount) {
            throw new IllegalArgumentException("worker index out of range: " + workerIndex);
        }
    }
}
