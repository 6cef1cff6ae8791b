/**
 * Jackson-based reading of work products and overrides, and writing of
 * validation reports.
 *
 * @since 1.0.0
 */
package com.factgate.core.json;
