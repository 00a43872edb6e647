package com.gt.vocab.sync;

/**
 * Transaction-scoped lock that serializes sync imports against each other and against card writes.
 * Both methods must be called inside an open transaction; the lock is released when it ends.
 */
public interface MergeLockDao {

    // Taken by reviews and card writes; any number may hold it at once
    void acquireSharedLock();

    // Taken by imports; waits for all shared holders and excludes everyone else
    void acquireExclusiveLock();
}
