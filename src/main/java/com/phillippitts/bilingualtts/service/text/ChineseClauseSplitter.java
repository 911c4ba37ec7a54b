package com.phillippitts.bilingualtts.service.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Chinese text on terminal punctuation, then splits over-long clauses on minor punctuation.
 *
 * <p>Punctuation stays attached to the clause it ends. Sub-clauses of an over-long clause are packed
 * greedily up to the maximum length. A single sub-clause longer than the maximum is kept whole.
 */
final class ChineseClauseSplitter {

    private static final String MAJOR = "。！？；";
    private static final String MINOR = "，、：";

    private final int maxLength;

    ChineseClauseSplitter(int maxLength) {
        this.maxLength = maxLength;
    }

    List<String> split(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        for (String clause : cutAfter(text, MAJOR)) {
            String trimmed = clause.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() > maxLength) {
                packGreedily(cutAfter(trimmed, MINOR), result);
            } else {
                result.add(trimmed);
            }
        }
        return result;
    }

    private void packGreedily(List<String> parts, List<String> out) {
        StringBuilder current = new StringBuilder();
        for (String part : parts) {
            if (current.length() + part.length() <= maxLength) {
                current.append(part);
            } else {
                addIfPresent(current.toString(), out);
                current.setLength(0);
                current.append(part);
            }
        }
        addIfPresent(current.toString(), out);
    }

    private static void addIfPresent(String candidate, List<String> out) {
        String trimmed = candidate.strip();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }

    /** Cuts {@code text} after every character in {@code marks}; the tail after the last mark is kept. */
    private static List<String> cutAfter(String text, String marks) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (marks.indexOf(text.charAt(i)) >= 0) {
                parts.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            parts.add(text.substring(start));
        }
        return parts;
    }
}
