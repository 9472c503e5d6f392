package com.afterlands.aftertranslator.api.exception;

/**
 * Base type of every failure reported by a translation call.
 *
 * <p>Subclasses:</p>
 * <ul>
 *     <li>{@link LocaleParseException} - unknown locale tag</li>
 *     <li>{@link TemplateException} - malformed plural guard syntax</li>
 *     <li>{@link MissingPluralContextException} - pluralized template without a count</li>
 *     <li>{@link MessageNotFoundException} - no catalogue in the fallback chain defines the message</li>
 * </ul>
 */
public abstract class TranslationException extends Exception {

    protected TranslationException(String message) {
        super(message);
    }
}
