package com.example.pipelinesync.service.mirror;

import lombok.Getter;

/**
 * Counters accumulated by one sync run.
 * Created and updated are for monitoring only; an upsert is correct either way.
 */
@Getter
public class SyncStats {

    private int fetched;
    private int created;
    private int updated;
    private int failed;

    public void addFetched(int count) {
        fetched += count;
    }

    public void recordUpsert(boolean inserted) {
        if (inserted) {
            created++;
        } else {
            updated++;
        }
    }

    public void recordFailure() {
        failed++;
    }

    public SyncStats snapshot() {
        SyncStats copy = new SyncStats();
        copy.fetched = fetched;
        copy.created = created;
        copy.updated = updated;
        copy.failed = failed;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("fetched=%d created=%d updated=%d failed=%d", fetched, created, updated, failed);
    }
}
