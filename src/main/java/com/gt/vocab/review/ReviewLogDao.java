package com.gt.vocab.review;

import com.gt.vocab.model.ReviewLog;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface ReviewLogDao {

    void createReviewLog(ReviewLog reviewLog);
    int createReviewLogs(List<ReviewLog> reviewLogs);

    List<ReviewLog> loadAllReviewLogs();
    Set<String> findVocabIdsGradedBelow(int grade, Instant start, Instant end);
}
