package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.config.properties.SegmentationProperties;
import com.phillippitts.bilingualtts.domain.TextSpan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts raw request text into bounded chunks and each chunk into positioned lines.
 *
 * <p>A chunk ends after the last terminal mark ({@code 。！？；.!?}) or newline that fits within the
 * maximum chunk length. Without one it ends at the last whitespace, and without that it is cut hard
 * (never inside a surrogate pair). Chunks are contiguous: concatenated they reproduce the input.
 *
 * <p>A period follows the English sentence rules: it is not a cut point inside a decimal
 * ({@code 3.14}) or after an abbreviation or number ({@code Mr.}, {@code NASA.}, {@code 42.}).
 */
@Component
public class TextChunker {

    private static final String TERMINAL_MARKS = "。！？；.!?\n";

    private final int maxChunkLength;

    public TextChunker(SegmentationProperties properties) {
        this.maxChunkLength = Objects.requireNonNull(properties, "properties").getMaxChunkLength();
    }

    public List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int start = 0;
        while (text.length() - start > maxChunkLength) {
            int end = cutPoint(text, start, start + maxChunkLength);
            chunks.add(text.substring(start, end));
            start = end;
        }
        chunks.add(text.substring(start));
        return chunks;
    }

    /**
     * Splits a chunk on {@code \n}. Lines are trimmed and blank lines are skipped, but every line
     * keeps its original position so indices stay stable for naming and ordering.
     */
    public List<TextSpan> lines(String chunk, int chunkIndex) {
        List<TextSpan> spans = new ArrayList<>();
        if (chunk == null) {
            return spans;
        }
        String[] lines = chunk.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (!line.isEmpty()) {
                spans.add(new TextSpan(line, chunkIndex, i));
            }
        }
        return spans;
    }

    /** {@link #chunk} followed by {@link #lines} for every chunk, in reading order. */
    public List<TextSpan> spans(String text) {
        List<TextSpan> spans = new ArrayList<>();
        List<String> chunks = chunk(text);
        for (int c = 0; c < chunks.size(); c++) {
            spans.addAll(lines(chunks.get(c), c));
        }
        return spans;
    }

    // Returns an exclusive end index in (start, limit].
    private static int cutPoint(String text, int start, int limit) {
        for (int i = limit - 1; i > start; i--) {
            char c = text.charAt(i);
            if (TERMINAL_MARKS.indexOf(c) >= 0 && (c != '.' || closesSentence(text, i))) {
                return i + 1;
            }
        }
        for (int i = limit - 1; i > start; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        if (Character.isHighSurrogate(text.charAt(limit - 1)) && limit - 1 > start) {
            return limit - 1;
        }
        return limit;
    }

    private static boolean closesSentence(String text, int dot) {
        if (dot + 1 < text.length() && TextCharacters.isAsciiDigit(text.charAt(dot + 1))
                && dot > 0 && TextCharacters.isAsciiDigit(text.charAt(dot - 1))) {
            return false;
        }
        int wordStart = dot;
        while (wordStart > 0 && !Character.isWhitespace(text.charAt(wordStart - 1))) {
            wordStart--;
        }
        return !EnglishSentenceSplitter.isAbbreviation(text.substring(wordStart, dot + 1));
    }
}
