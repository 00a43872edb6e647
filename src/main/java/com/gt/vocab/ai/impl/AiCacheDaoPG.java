package com.gt.vocab.ai.impl;

import com.gt.vocab.ai.AiCacheDao;
import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.AiCacheEntry;
import com.gt.vocab.util.JsonColumnMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public class AiCacheDaoPG implements AiCacheDao {

    private static final String LOAD_CACHE_ENTRY_SQL =
            "SELECT cache_key, term_normalized, version, provider, data, created_at, updated_at " +
            "FROM ai_cache " +
            "WHERE cache_key = :cacheKey";

    private static final String UPSERT_CACHE_ENTRY_SQL =
            "INSERT INTO ai_cache (cache_key, term_normalized, version, provider, data, created_at, updated_at) " +
            "VALUES (:cacheKey, :termNormalized, :version, :provider, CAST(:data AS JSONB), :updatedAt, :updatedAt) " +
            "ON CONFLICT (cache_key) DO UPDATE " +
                    "SET term_normalized = :termNormalized, version = :version, provider = :provider, data = CAST(:data AS JSONB), updated_at = :updatedAt";

    private final NamedParameterJdbcTemplate template;
    private final JsonColumnMapper jsonColumnMapper;

    public AiCacheDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        this.template = namedParameterJdbcTemplate;
        this.jsonColumnMapper = jsonColumnMapper;
    }

    @Override
    public Optional<AiCacheEntry> loadCacheEntry(String cacheKey) {
        return template.query(LOAD_CACHE_ENTRY_SQL, Map.of("cacheKey", cacheKey), this::mapCacheEntryRow).stream().findFirst();
    }

    @Override
    public AiCacheEntry upsertCacheEntry(AiCacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("cacheKey", entry.cacheKey());
        params.addValue("termNormalized", entry.termNormalized());
        params.addValue("version", entry.version());
        params.addValue("provider", entry.provider());
        params.addValue("data", jsonColumnMapper.write(entry.data()));
        params.addValue("updatedAt", Timestamp.from(entry.updatedAt()));

        template.update(UPSERT_CACHE_ENTRY_SQL, params);

        return loadCacheEntry(entry.cacheKey())
                .orElseThrow(() -> new DaoException("Cache entry " + entry.cacheKey() + " missing after upsert"));
    }

    private AiCacheEntry mapCacheEntryRow(ResultSet rs, int rowNum) throws SQLException {
        return new AiCacheEntry(
                rs.getString("cache_key"),
                rs.getString("term_normalized"),
                rs.getString("version"),
                rs.getString("provider"),
                jsonColumnMapper.readObject(rs.getString("data")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
