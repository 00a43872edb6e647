package com.gt.vocab.review.impl;

import com.gt.vocab.model.QuestionType;
import com.gt.vocab.model.ReviewLog;
import com.gt.vocab.model.ReviewMode;
import com.gt.vocab.review.ReviewLogDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class ReviewLogDaoPG implements ReviewLogDao {

    private static final String CREATE_REVIEW_LOG_SQL =
            "INSERT INTO review_log (id, vocab_id, mode, question_type, grade, user_answer, is_near_correct, created_at) " +
            "VALUES (:id, :vocabId, :mode, :questionType, :grade, :userAnswer, :isNearCorrect, :createdAt)";

    private static final String LOAD_ALL_REVIEW_LOGS_SQL =
            "SELECT id, vocab_id, mode, question_type, grade, user_answer, is_near_correct, created_at " +
            "FROM review_log " +
            "ORDER BY created_at ASC";

    private static final String FIND_VOCAB_IDS_GRADED_BELOW_SQL =
            "SELECT DISTINCT vocab_id " +
            "FROM review_log " +
            "WHERE created_at >= :start AND created_at < :end AND grade < :grade";

    private final NamedParameterJdbcTemplate template;

    public ReviewLogDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void createReviewLog(ReviewLog reviewLog) {
        template.update(CREATE_REVIEW_LOG_SQL, getReviewLogParams(reviewLog));
    }

    @Override
    public int createReviewLogs(List<ReviewLog> reviewLogs) {
        if (reviewLogs.isEmpty()) {
            return 0;
        }

        SqlParameterSource paramsArray[] = new SqlParameterSource[reviewLogs.size()];
        for (int index = 0; index < reviewLogs.size(); index++) {
            paramsArray[index] = getReviewLogParams(reviewLogs.get(index));
        }

        return Arrays.stream(template.batchUpdate(CREATE_REVIEW_LOG_SQL, paramsArray))
                .map(updateCnt -> updateCnt < 0 ? 1 : updateCnt)   // drivers may report SUCCESS_NO_INFO for batched rows
                .sum();
    }

    @Override
    public List<ReviewLog> loadAllReviewLogs() {
        return template.query(LOAD_ALL_REVIEW_LOGS_SQL, Map.of(), ReviewLogDaoPG::mapReviewLogRow);
    }

    @Override
    public Set<String> findVocabIdsGradedBelow(int grade, Instant start, Instant end) {
        return new HashSet<>(template.queryForList(FIND_VOCAB_IDS_GRADED_BELOW_SQL,
                Map.of("grade", grade, "start", Timestamp.from(start), "end", Timestamp.from(end)),
                String.class));
    }

    private static MapSqlParameterSource getReviewLogParams(ReviewLog reviewLog) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", reviewLog.id());
        params.addValue("vocabId", reviewLog.vocabId());
        params.addValue("mode", reviewLog.mode().getWireName());
        params.addValue("questionType", reviewLog.questionType().getWireName());
        params.addValue("grade", reviewLog.grade());
        params.addValue("userAnswer", reviewLog.userAnswer());
        params.addValue("isNearCorrect", reviewLog.isNearCorrect());
        params.addValue("createdAt", Timestamp.from(reviewLog.createdAt()));
        return params;
    }

    private static ReviewLog mapReviewLogRow(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewLog(
                rs.getString("id"),
                rs.getString("vocab_id"),
                ReviewMode.fromWireName(rs.getString("mode")).orElse(ReviewMode.Flip),
                QuestionType.fromWireName(rs.getString("question_type")).orElse(QuestionType.TermToMeaning),
                rs.getInt("grade"),
                rs.getString("user_answer"),
                rs.getObject("is_near_correct", Boolean.class),
                toInstant(rs.getTimestamp("created_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
