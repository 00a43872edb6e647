package com.gt.vocab.support;

import com.gt.vocab.sync.MergeLockDao;

public class RecordingMergeLockDao implements MergeLockDao {

    private int sharedAcquisitions;
    private int exclusiveAcquisitions;

    @Override
    public void acquireSharedLock() {
        sharedAcquisitions++;
    }

    @Override
    public void acquireExclusiveLock() {
        exclusiveAcquisitions++;
    }

    public int getSharedAcquisitions() {
        return sharedAcquisitions;
    }

    public int getExclusiveAcquisitions() {
        return exclusiveAcquisitions;
    }
}
