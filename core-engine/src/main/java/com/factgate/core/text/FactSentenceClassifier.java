package com.factgate.core.text;

import java.util.List;

/**
 * Decides whether a sentence states a fact and is therefore subject to the
 * stricter fact-token limit.
 *
 * <p>
 * The boundary between a fact sentence and an ordinary one is
 * domain-specific, so it is a strategy supplied through the rule
 * configuration. Built-in strategies live in {@link FactSentenceClassifiers}.
 * Implementations must be stateless.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FactSentenceClassifier {

    /**
     * @param sentence        the sentence
     * @param words           its word tokens
     * @param mentionedFields declared fields of the work product mentioned in
     *                        the sentence
     * @return {@code true} if the sentence is a fact sentence
     */
    boolean isFactSentence(Sentence sentence, List<String> words, List<String> mentionedFields);
}
