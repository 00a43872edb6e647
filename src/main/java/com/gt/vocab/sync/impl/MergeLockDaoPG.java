package com.gt.vocab.sync.impl;

import com.gt.vocab.sync.MergeLockDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Map;

public class MergeLockDaoPG implements MergeLockDao {

    // Arbitrary application-wide key for pg_advisory_xact_lock
    private static final long MERGE_LOCK_KEY = 0x766f636162L;

    private static final String ACQUIRE_SHARED_LOCK_SQL = "SELECT pg_advisory_xact_lock_shared(:lockKey)";
    private static final String ACQUIRE_EXCLUSIVE_LOCK_SQL = "SELECT pg_advisory_xact_lock(:lockKey)";

    private final NamedParameterJdbcTemplate template;

    public MergeLockDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void acquireSharedLock() {
        template.query(ACQUIRE_SHARED_LOCK_SQL, Map.of("lockKey", MERGE_LOCK_KEY), rs -> { });
    }

    @Override
    public void acquireExclusiveLock() {
        template.query(ACQUIRE_EXCLUSIVE_LOCK_SQL, Map.of("lockKey", MERGE_LOCK_KEY), rs -> { });
    }
}
