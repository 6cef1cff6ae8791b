/**
 * Text analysis used by the lexicon and number-grounding validators:
 * sentence splitting, word tokenizing, numeric literal scanning and
 * normalization, number exclusions and fact sentence classification.
 *
 * @since 1.0.0
 */
package com.factgate.core.text;
