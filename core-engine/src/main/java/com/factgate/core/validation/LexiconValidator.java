package com.factgate.core.validation;

import com.factgate.core.config.ForbiddenRule;
import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.WorkProduct;
import com.factgate.core.text.Sentence;
import com.factgate.core.text.SentenceSplitter;
import com.factgate.core.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Enforces the language rules on body text.
 *
 * <ul>
 * <li>Every sentence longer than {@code max_sentence_words} words: warning
 * {@code sentence_too_long}.</li>
 * <li>Every fact sentence (as decided by the configured classifier) longer
 * than {@code max_fact_tokens} tokens: warning
 * {@code fact_sentence_too_long}.</li>
 * <li>Every occurrence of a forbidden verb or term (case-insensitive, whole
 * word) and every match of a forbidden pattern: error
 * {@code forbidden_language}, ordered by position.</li>
 * </ul>
 *
 * <p>
 * Findings are independent: one sentence may yield warnings while a
 * forbidden term in it yields an error. This validator is
 * <strong>stateless</strong>.
 * </p>
 *
 * @since 1.0.0
 */
public class LexiconValidator implements DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(LexiconValidator.class);

    public static final String NAME = "lexicon";

    private static final int PREVIEW_LENGTH = 60;

    @Override
    public boolean appliesTo(ValidationContext context) {
        return context.getBody().isPresent();
    }

    @Override
    public List<ValidationFinding> validate(ValidationContext context) {
        Objects.requireNonNull(context, "ValidationContext must not be null");
        if (context.getBody().isEmpty()) {
            LOG.trace("No body text - skipping lexicon checks");
            return List.of();
        }
        String body = context.getBody().get();
        List<ValidationFinding> findings = new ArrayList<>();
        checkSentenceLengths(body, context.getWorkProduct(), context.getConfig(), findings);
        checkForbiddenLanguage(body, context.getConfig(), findings);
        return findings;
    }

    @Override
    public String getName() {
        return NAME;
    }

    // ---------------------------------------------------------------
    // Sentence length
    // ---------------------------------------------------------------

    private void checkSentenceLengths(String body, WorkProduct workProduct, RuleConfig config,
                                      List<ValidationFinding> findings) {
        for (Sentence sentence : SentenceSplitter.split(body)) {
            List<String> words = WordTokenizer.tokenize(sentence.getText());

            if (words.size() > config.getMaxSentenceWords()) {
                LOG.debug("Rule [{}] fired at {}: {} words", RuleIds.SENTENCE_TOO_LONG, sentence.getStart(), words.size());
                findings.add(warning(RuleIds.SENTENCE_TOO_LONG, sentence,
                        "Sentence too long (" + words.size() + " words, max "
                                + config.getMaxSentenceWords() + "): " + preview(sentence.getText())));
            }

            List<String> mentioned = config.getFieldMentions().mentionedIn(sentence.getText(), workProduct::has);
            if (words.size() > config.getMaxFactTokens()
                    && config.getFactSentenceClassifier().isFactSentence(sentence, words, mentioned)) {
                LOG.debug("Rule [{}] fired at {}: {} tokens", RuleIds.FACT_SENTENCE_TOO_LONG,
                        sentence.getStart(), words.size());
                findings.add(warning(RuleIds.FACT_SENTENCE_TOO_LONG, sentence,
                        "Fact sentence too long (" + words.size() + " tokens, max "
                                + config.getMaxFactTokens() + "): " + preview(sentence.getText())));
            }
        }
    }

    // ---------------------------------------------------------------
    // Forbidden language
    // ---------------------------------------------------------------

    private void checkForbiddenLanguage(String body, RuleConfig config, List<ValidationFinding> findings) {
        List<ForbiddenHit> hits = new ArrayList<>();
        List<ForbiddenRule> rules = config.getForbiddenRules();
        for (int i = 0; i < rules.size(); i++) {
            ForbiddenRule rule = rules.get(i);
            Matcher m = rule.getPattern().matcher(body);
            while (m.find()) {
                if (m.end() > m.start()) {
                    hits.add(new ForbiddenHit(m.start(), m.group(), rule, i));
                }
            }
        }
        hits.sort(Comparator.comparingInt(ForbiddenHit::start).thenComparingInt(ForbiddenHit::ruleIndex));

        for (ForbiddenHit hit : hits) {
            LOG.debug("Rule [{}] fired at {}: {}", RuleIds.FORBIDDEN_LANGUAGE, hit.start(), hit.rule().identity());
            findings.add(ValidationFinding.builder()
                    .error()
                    .ruleId(RuleIds.FORBIDDEN_LANGUAGE)
                    .validator(NAME)
                    .offset(hit.start())
                    .span(hit.text())
                    .message("Forbidden " + hit.rule().getKind().value() + " '"
                            + hit.rule().getExpression() + "' found: '" + hit.text() + "'")
                    .build());
        }
    }

    private static ValidationFinding warning(String ruleId, Sentence sentence, String message) {
        return ValidationFinding.builder()
                .warning()
                .ruleId(ruleId)
                .validator(NAME)
                .offset(sentence.getStart())
                .span(sentence.getText())
                .message(message)
                .build();
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static final class ForbiddenHit {
        private final int start;
        private final String text;
        private final ForbiddenRule rule;
        private final int ruleIndex;

        ForbiddenHit(int start, String text, ForbiddenRule rule, int ruleIndex) {
            this.start = start;
            this.text = text;
            this.rule = rule;
            this.ruleIndex = ruleIndex;
        }

        int start() {
            return start;
        }

        String text() {
            return text;
        }

        ForbiddenRule rule() {
            return rule;
        }

        int ruleIndex() {
            return ruleIndex;
        }
    }
}
