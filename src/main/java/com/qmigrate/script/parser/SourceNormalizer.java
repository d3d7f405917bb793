package com.qmigrate.script.parser;

import java.util.regex.Pattern;

/**
 * Text clean-up applied before parsing: fully commented lines are dropped and
 * backslash line continuations are joined. Keeps the grammar line based.
 */
public final class SourceNormalizer {

    private static final Pattern COMMENT_LINE = Pattern.compile("\n#[^\n]*\n");
    private static final Pattern CONTINUATION_AFTER_TEXT = Pattern.compile("([^\\t ])\\\\[ \\t]*\\r?\n");
    private static final Pattern CONTINUATION = Pattern.compile("\\\\[ \\t]*\\r?\n");

    private SourceNormalizer() {}

    public static String normalize(String contents) {
        if (contents == null) return "";
        return joinContinuations(stripCommentLines(contents));
    }

    /**
     * A commented line inside a multi-line assignment would otherwise end the
     * assignment early, so it is removed as if it never existed.
     */
    public static String stripCommentLines(String contents) {
        String text = "\n" + contents;
        String previous;
        do {
            previous = text;
            text = COMMENT_LINE.matcher(text).replaceAll("\n");
        } while (!text.equals(previous));
        return text.substring(1);
    }

    public static String joinContinuations(String contents) {
        String text = CONTINUATION_AFTER_TEXT.matcher(contents).replaceAll("$1 ");
        return CONTINUATION.matcher(text).replaceAll("");
    }
}
