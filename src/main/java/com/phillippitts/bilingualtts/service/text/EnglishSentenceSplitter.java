package com.phillippitts.bilingualtts.service.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits English text into sentence and clause sized pieces on whitespace-separated words.
 *
 * <p>A piece closes after a word ending in {@code . ! ? , ; :} or once the joined length reaches
 * the maximum. A trailing period does not close the piece when it looks like an abbreviation or a
 * number ({@code Mr.}, {@code NASA.}, {@code 3.}). Pieces shorter than the minimum are dropped
 * unless they are numeric.
 */
final class EnglishSentenceSplitter {

    private final int maxLength;
    private final int minLength;

    EnglishSentenceSplitter(int maxLength, int minLength) {
        this.maxLength = maxLength;
        this.minLength = minLength;
    }

    List<String> split(String text) {
        List<String> pieces = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return pieces;
        }
        String trimmed = text.strip();
        if (TextCharacters.isNumeric(trimmed)) {
            pieces.add(trimmed);
            return pieces;
        }

        StringBuilder current = new StringBuilder();
        for (String word : trimmed.split("\\s+")) {
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);

            boolean punctuated = endsWithBreak(word) && !isAbbreviation(word);
            if (punctuated || current.length() >= maxLength) {
                emit(current.toString(), pieces);
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            emit(current.toString(), pieces);
        }
        return pieces;
    }

    private void emit(String candidate, List<String> pieces) {
        String piece = candidate.strip();
        if (piece.length() >= minLength || TextCharacters.isNumeric(piece)) {
            pieces.add(piece);
        }
    }

    private static boolean endsWithBreak(String word) {
        char last = word.charAt(word.length() - 1);
        return ".!?,;:".indexOf(last) >= 0;
    }

    static boolean isAbbreviation(String word) {
        if (!word.endsWith(".")) {
            return false;
        }
        String stem = word.substring(0, word.length() - 1);
        return TextCharacters.isNumeric(stem) || isAllUpperCase(stem) || word.length() <= 3;
    }

    // Vacuously true for an empty stem.
    private static boolean isAllUpperCase(String stem) {
        for (int i = 0; i < stem.length(); i++) {
            if (!Character.isUpperCase(stem.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
