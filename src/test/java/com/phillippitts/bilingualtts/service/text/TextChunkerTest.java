package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.config.properties.SegmentationProperties;
import com.phillippitts.bilingualtts.domain.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker(new SegmentationProperties(null, null, null, 20));

    @Test
    void shortTextIsOneChunk() {
        assertThat(chunker.chunk("short")).containsExactly("short");
        assertThat(chunker.chunk("")).isEmpty();
    }

    @Test
    void prefersTerminalPunctuationThenWhitespace() {
        String text = "Hello there. This is a longer sentence";

        List<String> chunks = chunker.chunk(text);

        assertThat(chunks.get(0)).isEqualTo("Hello there.");
        assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(20));
        assertThat(String.join("", chunks)).isEqualTo(text);
    }

    @Test
    void cutsAfterChineseTerminalMark() {
        String text = "第一句话说完了。第二句话也说完了。第三句还没有说完";

        List<String> chunks = chunker.chunk(text);

        assertThat(chunks.get(0)).isEqualTo("第一句话说完了。第二句话也说完了。");
        assertThat(String.join("", chunks)).isEqualTo(text);
    }

    @Test
    void hardCutsWhenNoBreakExists() {
        assertThat(chunker.chunk("abcdefghijklmnopqrstuvwxyz"))
                .containsExactly("abcdefghijklmnopqrst", "uvwxyz");
    }

    @Test
    void neverCutsInsideDecimalOrAfterAbbreviation() {
        TextChunker narrow = new TextChunker(new SegmentationProperties(null, null, null, 22));
        String text = "The value of pi is 3.14159 and Mr. Smith agrees";

        List<String> chunks = narrow.chunk(text);

        assertThat(chunks).containsExactly("The value of pi is ", "3.14159 and Mr. Smith ", "agrees");
        assertThat(narrow.spans(text)).extracting(TextSpan::text)
                .containsExactly("The value of pi is", "3.14159 and Mr. Smith", "agrees");
    }

    @Test
    void periodAfterNumberIsNotACutPoint() {
        TextChunker narrow = new TextChunker(new SegmentationProperties(null, null, null, 16));

        assertThat(narrow.chunk("We counted 42. Then we left")).first().isEqualTo("We counted 42. ");
        assertThat(narrow.chunk("Fine. We counted 42. Then")).first().isEqualTo("Fine.");
    }

    @Test
    void linesSkipBlanksButKeepPositions() {
        assertThat(chunker.lines("a\n\n  b  \r\n", 2)).containsExactly(
                new TextSpan("a", 2, 0),
                new TextSpan("b", 2, 2));
    }

    @Test
    void spansCarryChunkIndex() {
        List<TextSpan> spans = chunker.spans("line one is here.\nline two");

        assertThat(spans).extracting(TextSpan::chunkIndex).containsExactly(0, 1);
        assertThat(spans).extracting(TextSpan::text).containsExactly("line one is here.", "line two");
    }
}
