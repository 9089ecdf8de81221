package com.webhookinbox.storage;

/**
 * Conjunctive filters for {@link MessageStore#query}. Null or empty values mean "no filter".
 *
 * @param from         exact sender match
 * @param since        inclusive lower bound on {@code ts}, compared as a string
 * @param textContains case-sensitive substring of {@code text}
 */
public record MessageFilter(String from, String since, String textContains) {

    public static final MessageFilter NONE = new MessageFilter(null, null, null);

    public MessageFilter {
        from = blankToNull(from);
        since = blankToNull(since);
        textContains = blankToNull(textContains);
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
