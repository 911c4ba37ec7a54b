package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.domain.LanguageTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits mixed Chinese/English text into single-language runs with one character scan.
 *
 * <p>CJK ideographs and CJK punctuation belong to a Chinese run, Latin letters to an English run.
 * A number ({@code [0-9][0-9.%]*}) is taken whole and joins the Chinese run when a CJK ideograph
 * occurs within the context window before its first digit, or in the window starting at it.
 * Otherwise it joins the English run. Any other character is appended to the open run and dropped
 * when no run is open. Every language change closes the current run.
 */
final class MixedTextSplitter {

    private final int minLength;
    private final int contextWindow;

    MixedTextSplitter(int minLength, int contextWindow) {
        this.minLength = minLength;
        this.contextWindow = contextWindow;
    }

    List<LanguageRun> split(String text) {
        List<LanguageRun> runs = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return runs;
        }
        String trimmed = text.strip();
        if (TextCharacters.isNumeric(trimmed)) {
            runs.add(new LanguageRun(trimmed, LanguageTag.EN));
            return runs;
        }

        StringBuilder buffer = new StringBuilder();
        LanguageTag current = null;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (TextCharacters.isCjk(c)) {
                current = switchTo(LanguageTag.ZH, current, buffer, runs);
                buffer.append(c);
                i++;
            } else if (TextCharacters.isAsciiDigit(c)) {
                int end = i;
                while (end < text.length() && TextCharacters.isNumericSymbol(text.charAt(end))) {
                    end++;
                }
                LanguageTag numberLanguage = inChineseContext(text, i) ? LanguageTag.ZH : LanguageTag.EN;
                current = switchTo(numberLanguage, current, buffer, runs);
                buffer.append(text, i, end);
                i = end;
            } else if (TextCharacters.isLatinLetter(c)) {
                current = switchTo(LanguageTag.EN, current, buffer, runs);
                buffer.append(c);
                i++;
            } else {
                if (buffer.length() > 0) {
                    buffer.append(c);
                }
                i++;
            }
        }
        flush(buffer, current, runs);
        return runs;
    }

    boolean inChineseContext(String text, int position) {
        return TextCharacters.containsCjkIdeograph(text, position - contextWindow, position)
                || TextCharacters.containsCjkIdeograph(text, position, position + contextWindow);
    }

    private LanguageTag switchTo(LanguageTag next, LanguageTag current, StringBuilder buffer,
                                 List<LanguageRun> runs) {
        if (next != current) {
            flush(buffer, current, runs);
        }
        return next;
    }

    private void flush(StringBuilder buffer, LanguageTag language, List<LanguageRun> runs) {
        String piece = buffer.toString().strip();
        buffer.setLength(0);
        if (piece.isEmpty() || language == null) {
            return;
        }
        if (language == LanguageTag.ZH || piece.length() >= minLength || TextCharacters.isNumeric(piece)) {
            runs.add(new LanguageRun(piece, language));
        }
    }
}
