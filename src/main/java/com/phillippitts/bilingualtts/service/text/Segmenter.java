package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.config.properties.SegmentationProperties;
import com.phillippitts.bilingualtts.domain.LanguageTag;
import com.phillippitts.bilingualtts.domain.Segment;
import com.phillippitts.bilingualtts.domain.TextType;
import com.phillippitts.bilingualtts.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits one line of text into ordered, single-language {@link Segment}s.
 *
 * <p>The strategy is chosen by the {@link LanguageClassifier} verdict for the whole line. Each
 * emitted segment carries the caller's chunk and line index plus a zero-based segment index in
 * emission order, which is the order the audio is assembled in.
 *
 * <p>A line may yield zero segments (for example a lone punctuation mark). That is not an error
 * here; the pipeline fails only when a whole request yields nothing.
 */
@Component
public class Segmenter {

    private static final Logger LOG = LogManager.getLogger(Segmenter.class);

    private final LanguageClassifier classifier;
    private final EnglishSentenceSplitter englishSplitter;
    private final ChineseClauseSplitter chineseSplitter;
    private final MixedTextSplitter mixedSplitter;

    public Segmenter(LanguageClassifier classifier, SegmentationProperties properties) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(properties, "properties");
        this.englishSplitter = new EnglishSentenceSplitter(
                properties.getMaxSegmentLength(), properties.getMinSegmentLength());
        this.chineseSplitter = new ChineseClauseSplitter(properties.getMaxSegmentLength());
        this.mixedSplitter = new MixedTextSplitter(
                properties.getMinSegmentLength(), properties.getNumericContextWindow());
    }

    public List<Segment> segment(String text, int chunkIndex, int lineIndex) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<LanguageRun> runs = runs(text);
        List<Segment> segments = new ArrayList<>(runs.size());
        for (LanguageRun run : runs) {
            segments.add(new Segment(run.text(), run.language(), chunkIndex, lineIndex, segments.size()));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Segmented line {}_{} into {} segment(s): '{}'",
                    chunkIndex, lineIndex, segments.size(), LogSanitizer.preview(text));
        }
        return List.copyOf(segments);
    }

    private List<LanguageRun> runs(String text) {
        String trimmed = text.strip();
        if (TextCharacters.isNumeric(trimmed)) {
            return List.of(new LanguageRun(trimmed, LanguageTag.EN));
        }
        TextType type = classifier.classify(text);
        return switch (type) {
            case EN -> tag(englishSplitter.split(text), LanguageTag.EN);
            case ZH -> tag(chineseSplitter.split(text), LanguageTag.ZH);
            case MIXED -> mixedSplitter.split(text);
        };
    }

    private static List<LanguageRun> tag(List<String> pieces, LanguageTag language) {
        List<LanguageRun> runs = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            runs.add(new LanguageRun(piece, language));
        }
        return runs;
    }
}
