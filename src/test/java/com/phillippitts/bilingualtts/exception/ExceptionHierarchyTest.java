package com.phillippitts.bilingualtts.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void synthesisFailuresShareOneBase() {
        assertThat(new SynthesisTimeoutException("t", "v", 10)).isInstanceOf(SynthesisException.class);
        assertThat(new SynthesisBackendException("b", "v")).isInstanceOf(SynthesisException.class);
        assertThat(new EmptySynthesisException("e", "v")).isInstanceOf(SynthesisException.class);
        assertThat(new NoArtifactsException(3, null)).isInstanceOf(SynthesisException.class);
    }

    @Test
    void everyDomainExceptionIsUnchecked() {
        assertThat(new InvalidInputException("x")).isInstanceOf(BilingualTtsException.class);
        assertThat(new NoSegmentsException(4)).isInstanceOf(BilingualTtsException.class);
        assertThat(new AssemblyException("x")).isInstanceOf(BilingualTtsException.class);
        assertThat(new WorkspaceException("x", null)).isInstanceOf(BilingualTtsException.class);
        assertThat(new BilingualTtsException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void carriesContext() {
        assertThat(new InvalidInputException("empty text provided").getReason()).isEqualTo("empty text provided");
        assertThat(new NoSegmentsException(7).getInputLength()).isEqualTo(7);
        assertThat(new NoArtifactsException(2, new IllegalStateException()).getFailedSegments()).isEqualTo(2);
        assertThat(new SynthesisBackendException("b", "zh-CN-XiaoxiaoNeural").getMessage())
                .endsWith("(voice: zh-CN-XiaoxiaoNeural)");
    }
}
