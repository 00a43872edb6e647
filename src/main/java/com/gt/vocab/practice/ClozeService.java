package com.gt.vocab.practice;

import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.exception.ValidationException;
import com.gt.vocab.fuzzy.TypingJudge;
import com.gt.vocab.model.Vocab;
import com.gt.vocab.model.VocabFilterOptions;
import com.gt.vocab.util.ContentLists;
import com.gt.vocab.vocab.VocabDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fill-in-the-blank drills built from the card store. A question blanks the term out of the card's English example,
 * or asks for the term by its first meaning when the example does not contain it. Answers are judged, not recorded.
 */
@Component
public class ClozeService {

    private static final Logger log = LoggerFactory.getLogger(ClozeService.class);

    static final int DEFAULT_LIMIT = 5;
    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 30;

    static final String BLANK = "____";

    private final VocabDao vocabDao;
    private final TypingJudge typingJudge;

    @Autowired
    public ClozeService(VocabDao vocabDao, TypingJudge typingJudge) {
        this.vocabDao = vocabDao;
        this.typingJudge = typingJudge;
    }

    /**
     * Picks cards by id when any are given, otherwise by topic, otherwise the most recently updated ones. When the
     * selection comes back empty the cards due earliest are used instead.
     */
    public List<ClozeItem> generateCloze(List<String> vocabIds, String topic, int limit) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "Limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT);
        }

        List<Vocab> selected;
        if (vocabIds != null && !vocabIds.isEmpty()) {
            selected = vocabDao.loadVocabByIds(vocabIds, limit);
        } else {
            selected = vocabDao.searchVocab(new VocabFilterOptions(null, null, ContentLists.stripToNull(topic), null), 0, limit);
        }
        if (selected.isEmpty()) {
            selected = vocabDao.loadEarliestDueVocab(limit);
        }

        List<ClozeItem> items = new ArrayList<>();
        for (Vocab vocab : selected) {
            String term = vocab.content().term() == null ? "" : vocab.content().term().strip();
            if (term.isEmpty()) {
                continue;
            }

            String meaning = vocab.content().meanings().isEmpty() ? null : vocab.content().meanings().get(0);
            items.add(buildItem(vocab, term, meaning));
        }

        log.debug("Generated {} cloze items", items.size());
        return items;
    }

    public ClozeSubmitResult submitCloze(String vocabId, String userAnswer) {
        if (userAnswer == null || userAnswer.isEmpty()) {
            throw new ValidationException("userAnswer", "Answer must not be empty");
        }

        Vocab vocab = vocabDao.loadVocab(vocabId).orElseThrow(() -> new NotFoundException("Vocab not found: " + vocabId));
        String term = vocab.content().term() == null ? "" : vocab.content().term();

        boolean nearCorrect = typingJudge.isNearCorrect(userAnswer, acceptableAnswers(term, vocab.content().phrases()));
        boolean correct = userAnswer.strip().toLowerCase(Locale.ROOT).equals(term.strip().toLowerCase(Locale.ROOT));

        log.info("Cloze answer for {}: correct={}, nearCorrect={}", vocab.termNormalized(), correct, nearCorrect);
        return new ClozeSubmitResult(correct, nearCorrect, term);
    }

    private static ClozeItem buildItem(Vocab vocab, String term, String meaning) {
        String example = vocab.content().exampleEn();
        String question = null;
        String hint = null;

        if (example != null && !example.isEmpty()) {
            Matcher matcher = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(example);
            if (matcher.find()) {
                question = matcher.replaceFirst(Matcher.quoteReplacement(BLANK));
                hint = meaning == null || meaning.isEmpty() ? null : "Meaning: " + meaning;
            }
        }
        if (question == null) {
            question = "Fill in the blank: " + BLANK + " means '" + (meaning == null ? "" : meaning) + "'.";
        }

        return new ClozeItem(vocab.id(), term, vocab.content().ipa(), question, hint,
                acceptableAnswers(term, vocab.content().phrases()));
    }

    private static List<String> acceptableAnswers(String term, List<String> phrases) {
        List<String> answers = new ArrayList<>();
        answers.add(term);
        answers.addAll(phrases);
        return answers;
    }
}
