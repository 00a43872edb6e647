package com.gt.vocab.vocab.impl;

import com.gt.vocab.exception.DuplicateTermException;
import com.gt.vocab.model.ScheduleState;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabContent;
import com.gt.vocab.model.VocabFilterOptions;
import com.gt.vocab.util.JsonColumnMapper;
import com.gt.vocab.vocab.VocabDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class VocabDaoPG implements VocabDao {

    private static final Logger log = LoggerFactory.getLogger(VocabDaoPG.class);

    private static final String DUMMY_ID = "_dummy_id";

    private static final String VOCAB_COLUMNS =
            "id, term, term_normalized, meanings, ipa, example_en, example_vi, mnemonic, tags, collocations, phrases, word_family, topics, " +
            "cefr_level, ielts_band, ease_factor, interval_days, repetitions, lapses, due_at, last_reviewed_at, readd_count, last_readd_at, " +
            "created_at, updated_at, version";

    private static final String SELECT_VOCAB_SQL = "SELECT " + VOCAB_COLUMNS + " FROM vocab ";

    private static final String LOAD_VOCAB_SQL = SELECT_VOCAB_SQL + "WHERE id = :id";
    private static final String FIND_BY_TERM_NORMALIZED_SQL = SELECT_VOCAB_SQL + "WHERE term_normalized = :termNormalized";
    private static final String VOCAB_EXISTS_SQL = "SELECT COUNT(*) FROM vocab WHERE id = :id";

    private static final String CREATE_VOCAB_SQL =
            "INSERT INTO vocab (" + VOCAB_COLUMNS + ") " +
            "VALUES (:id, :term, :termNormalized, CAST(:meanings AS JSONB), :ipa, :exampleEn, :exampleVi, :mnemonic, CAST(:tags AS JSONB), " +
                    "CAST(:collocations AS JSONB), CAST(:phrases AS JSONB), CAST(:wordFamily AS JSONB), CAST(:topics AS JSONB), :cefrLevel, :ieltsBand, " +
                    ":easeFactor, :intervalDays, :repetitions, :lapses, :dueAt, :lastReviewedAt, :readdCount, :lastReaddAt, :createdAt, :updatedAt, 0) " +
            "ON CONFLICT (term_normalized) DO NOTHING";

    private static final String UPDATE_VOCAB_SQL =
            "UPDATE vocab " +
            "SET term = :term, term_normalized = :termNormalized, meanings = CAST(:meanings AS JSONB), ipa = :ipa, example_en = :exampleEn, " +
                    "example_vi = :exampleVi, mnemonic = :mnemonic, tags = CAST(:tags AS JSONB), collocations = CAST(:collocations AS JSONB), " +
                    "phrases = CAST(:phrases AS JSONB), word_family = CAST(:wordFamily AS JSONB), topics = CAST(:topics AS JSONB), " +
                    "cefr_level = :cefrLevel, ielts_band = :ieltsBand, ease_factor = :easeFactor, interval_days = :intervalDays, " +
                    "repetitions = :repetitions, lapses = :lapses, due_at = :dueAt, last_reviewed_at = :lastReviewedAt, readd_count = :readdCount, " +
                    "last_readd_at = :lastReaddAt, created_at = :createdAt, updated_at = :updatedAt, version = version + 1 " +
            "WHERE id = :id AND version = :expectedVersion";

    private static final String SEARCH_VOCAB_SQL_SELECT = SELECT_VOCAB_SQL + "WHERE TRUE ";
    private static final String SEARCH_VOCAB_SQL_TEXT_FILTER =
            "AND (term ILIKE :searchPattern " +
                    "OR EXISTS (SELECT 1 FROM jsonb_array_elements_text(meanings) m WHERE m ILIKE :searchPattern) " +
                    "OR EXISTS (SELECT 1 FROM jsonb_array_elements_text(tags) t WHERE t ILIKE :searchPattern) " +
                    "OR EXISTS (SELECT 1 FROM jsonb_array_elements_text(collocations) c WHERE c ILIKE :searchPattern) " +
                    "OR EXISTS (SELECT 1 FROM jsonb_array_elements_text(phrases) p WHERE p ILIKE :searchPattern) " +
                    "OR EXISTS (SELECT 1 FROM jsonb_array_elements_text(topics) tp WHERE tp ILIKE :searchPattern)) ";
    private static final String SEARCH_VOCAB_SQL_TAG_FILTER = "AND tags @> jsonb_build_array(CAST(:tag AS TEXT)) ";
    private static final String SEARCH_VOCAB_SQL_TOPIC_FILTER = "AND topics @> jsonb_build_array(CAST(:topic AS TEXT)) ";
    private static final String SEARCH_VOCAB_SQL_CEFR_FILTER = "AND cefr_level = :cefrLevel ";
    private static final String SEARCH_VOCAB_SQL_ORDER_AND_LIMIT = "ORDER BY updated_at DESC OFFSET :offset LIMIT :count";

    // review_log rows go with the card through ON DELETE CASCADE
    private static final String DELETE_VOCAB_SQL = "DELETE FROM vocab WHERE id = :id";

    private static final String LOAD_ALL_VOCAB_SQL = SELECT_VOCAB_SQL + "ORDER BY term_normalized ASC, created_at ASC";

    private static final String LOAD_VOCAB_CREATED_BETWEEN_SQL = SELECT_VOCAB_SQL +
            "WHERE created_at >= :start AND created_at < :end " +
            "ORDER BY created_at ASC";

    private static final String LOAD_DUE_VOCAB_SQL = SELECT_VOCAB_SQL +
            "WHERE due_at <= :now AND id NOT IN (:excludeIds) " +
            "ORDER BY due_at ASC LIMIT :count";

    private static final String LOAD_VOCAB_REVIEWED_BETWEEN_SQL = SELECT_VOCAB_SQL +
            "WHERE last_reviewed_at >= :start AND last_reviewed_at < :end AND id NOT IN (:excludeIds) " +
            "ORDER BY last_reviewed_at ASC";

    private static final String LOAD_READDED_VOCAB_SQL = SELECT_VOCAB_SQL +
            "WHERE readd_count > 0 AND id NOT IN (:excludeIds) " +
            "ORDER BY readd_count DESC, due_at ASC LIMIT :count";

    private static final String LOAD_VOCAB_BY_IDS_SQL = SELECT_VOCAB_SQL +
            "WHERE id IN (:ids) " +
            "ORDER BY updated_at DESC LIMIT :count";

    private static final String LOAD_EARLIEST_DUE_VOCAB_SQL = SELECT_VOCAB_SQL + "ORDER BY due_at ASC LIMIT :count";

    private final NamedParameterJdbcTemplate template;
    private final JsonColumnMapper jsonColumnMapper;

    public VocabDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        this.template = namedParameterJdbcTemplate;
        this.jsonColumnMapper = jsonColumnMapper;
    }

    @Override
    public Optional<Vocab> loadVocab(String vocabId) {
        return template.query(LOAD_VOCAB_SQL, Map.of("id", vocabId), this::mapVocabRow).stream().findFirst();
    }

    @Override
    public Optional<Vocab> findByTermNormalized(String termNormalized) {
        return template.query(FIND_BY_TERM_NORMALIZED_SQL, Map.of("termNormalized", termNormalized), this::mapVocabRow).stream().findFirst();
    }

    @Override
    public boolean vocabExists(String vocabId) {
        Integer count = template.queryForObject(VOCAB_EXISTS_SQL, Map.of("id", vocabId), Integer.class);
        return count != null && count > 0;
    }

    @Override
    public boolean createVocab(Vocab vocab) {
        return template.update(CREATE_VOCAB_SQL, getVocabParams(vocab)) > 0;
    }

    @Override
    public boolean updateVocab(Vocab vocab, long expectedVersion) {
        MapSqlParameterSource params = getVocabParams(vocab);
        params.addValue("expectedVersion", expectedVersion);

        try {
            int updated = template.update(UPDATE_VOCAB_SQL, params);
            if (updated == 0) {
                log.debug("Version {} of vocab {} is stale", expectedVersion, vocab.id());
            }
            return updated > 0;
        } catch (DuplicateKeyException ex) {
            throw new DuplicateTermException("Another vocab already uses the term " + vocab.termNormalized(), ex);
        }
    }

    @Override
    public List<Vocab> searchVocab(VocabFilterOptions filterOptions, int offset, int limit) {
        StringBuilder sql = new StringBuilder(SEARCH_VOCAB_SQL_SELECT);
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (isPresent(filterOptions.search())) {
            sql.append(SEARCH_VOCAB_SQL_TEXT_FILTER);
            params.addValue("searchPattern", "%" + escapeLikePattern(filterOptions.search().strip()) + "%");
        }
        if (isPresent(filterOptions.tag())) {
            sql.append(SEARCH_VOCAB_SQL_TAG_FILTER);
            params.addValue("tag", filterOptions.tag().strip());
        }
        if (isPresent(filterOptions.topic())) {
            sql.append(SEARCH_VOCAB_SQL_TOPIC_FILTER);
            params.addValue("topic", filterOptions.topic().strip());
        }
        if (isPresent(filterOptions.cefrLevel())) {
            sql.append(SEARCH_VOCAB_SQL_CEFR_FILTER);
            params.addValue("cefrLevel", filterOptions.cefrLevel().strip().toUpperCase(Locale.ROOT));
        }
        sql.append(SEARCH_VOCAB_SQL_ORDER_AND_LIMIT);
        params.addValue("offset", offset);
        params.addValue("count", limit);

        return template.query(sql.toString(), params, this::mapVocabRow);
    }

    @Override
    public int deleteVocab(String vocabId) {
        return template.update(DELETE_VOCAB_SQL, Map.of("id", vocabId));
    }

    @Override
    public List<Vocab> loadAllVocab() {
        return template.query(LOAD_ALL_VOCAB_SQL, Map.of(), this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadVocabCreatedBetween(Instant start, Instant end) {
        return template.query(LOAD_VOCAB_CREATED_BETWEEN_SQL,
                Map.of("start", Timestamp.from(start), "end", Timestamp.from(end)),
                this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadDueVocab(Instant now, Collection<String> excludeIds, int limit) {
        return template.query(LOAD_DUE_VOCAB_SQL,
                Map.of("now", Timestamp.from(now), "excludeIds", nonEmptyIdList(excludeIds), "count", limit),
                this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadVocabReviewedBetween(Instant start, Instant end, Collection<String> excludeIds) {
        return template.query(LOAD_VOCAB_REVIEWED_BETWEEN_SQL,
                Map.of("start", Timestamp.from(start), "end", Timestamp.from(end), "excludeIds", nonEmptyIdList(excludeIds)),
                this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadReaddedVocab(Collection<String> excludeIds, int limit) {
        return template.query(LOAD_READDED_VOCAB_SQL,
                Map.of("excludeIds", nonEmptyIdList(excludeIds), "count", limit),
                this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadVocabByIds(Collection<String> vocabIds, int limit) {
        return template.query(LOAD_VOCAB_BY_IDS_SQL,
                Map.of("ids", nonEmptyIdList(vocabIds), "count", limit),
                this::mapVocabRow);
    }

    @Override
    public List<Vocab> loadEarliestDueVocab(int limit) {
        return template.query(LOAD_EARLIEST_DUE_VOCAB_SQL, Map.of("count", limit), this::mapVocabRow);
    }

    private MapSqlParameterSource getVocabParams(Vocab vocab) {
        VocabContent content = vocab.content();
        ScheduleState schedule = vocab.schedule();

        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", vocab.id());
        params.addValue("term", content.term());
        params.addValue("termNormalized", vocab.termNormalized());
        params.addValue("meanings", jsonColumnMapper.write(content.meanings()));
        params.addValue("ipa", content.ipa());
        params.addValue("exampleEn", content.exampleEn());
        params.addValue("exampleVi", content.exampleVi());
        params.addValue("mnemonic", content.mnemonic());
        params.addValue("tags", jsonColumnMapper.write(content.tags()));
        params.addValue("collocations", jsonColumnMapper.write(content.collocations()));
        params.addValue("phrases", jsonColumnMapper.write(content.phrases()));
        params.addValue("wordFamily", jsonColumnMapper.write(content.wordFamily()));
        params.addValue("topics", jsonColumnMapper.write(content.topics()));
        params.addValue("cefrLevel", content.cefrLevel());
        params.addValue("ieltsBand", content.ieltsBand());
        params.addValue("easeFactor", schedule.easeFactor());
        params.addValue("intervalDays", schedule.intervalDays());
        params.addValue("repetitions", schedule.repetitions());
        params.addValue("lapses", schedule.lapses());
        params.addValue("dueAt", toTimestamp(schedule.dueAt()));
        params.addValue("lastReviewedAt", toTimestamp(schedule.lastReviewedAt()));
        params.addValue("readdCount", schedule.readdCount());
        params.addValue("lastReaddAt", toTimestamp(schedule.lastReaddAt()));
        params.addValue("createdAt", toTimestamp(vocab.createdAt()));
        params.addValue("updatedAt", toTimestamp(vocab.updatedAt()));

        return params;
    }

    private Vocab mapVocabRow(ResultSet rs, int rowNum) throws SQLException {
        VocabContent content = new VocabContent(
                rs.getString("term"),
                jsonColumnMapper.readStringList(rs.getString("meanings")),
                rs.getString("ipa"),
                rs.getString("example_en"),
                rs.getString("example_vi"),
                rs.getString("mnemonic"),
                jsonColumnMapper.readStringList(rs.getString("tags")),
                jsonColumnMapper.readStringList(rs.getString("collocations")),
                jsonColumnMapper.readStringList(rs.getString("phrases")),
                jsonColumnMapper.readWordFamily(rs.getString("word_family")),
                jsonColumnMapper.readStringList(rs.getString("topics")),
                rs.getString("cefr_level"),
                rs.getObject("ielts_band", Double.class));

        ScheduleState schedule = new ScheduleState(
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetitions"),
                rs.getInt("lapses"),
                toInstant(rs.getTimestamp("due_at")),
                toInstant(rs.getTimestamp("last_reviewed_at")),
                rs.getInt("readd_count"),
                toInstant(rs.getTimestamp("last_readd_at")));

        return new Vocab(
                rs.getString("id"),
                rs.getString("term_normalized"),
                content,
                schedule,
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getLong("version"));
    }

    // IN clauses need at least one entry
    private static Collection<String> nonEmptyIdList(Collection<String> ids) {
        return ids == null || ids.isEmpty() ? List.of(DUMMY_ID) : ids;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String escapeLikePattern(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
