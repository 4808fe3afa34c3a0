package com.mktsim.engine.kernel;

/**
 * Hands out order ids for one simulation run. Externally supplied ids (e.g.
 * from a replayed order stream) are reported through {@link #observe(long)} so
 * that allocated ids never collide with them.
 */
public final class OrderIdAllocator {

    private long nextId;

    public OrderIdAllocator() {
        this(1L);
    }

    public OrderIdAllocator(long firstId) {
        this.nextId = firstId;
    }

    public long next() {
        return nextId++;
    }

    public void observe(long externalId) {
        if (externalId >= nextId) nextId = externalId + 1;
    }

    public long peek() { return nextId; }
}
