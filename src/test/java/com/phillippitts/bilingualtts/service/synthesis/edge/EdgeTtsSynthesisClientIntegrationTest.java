package com.phillippitts.bilingualtts.service.synthesis.edge;

import com.phillippitts.bilingualtts.annotation.RequiresRealBinary;
import com.phillippitts.bilingualtts.config.synthesis.EdgeTtsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Integration test against the real edge-tts CLI. Needs the binary on PATH and network access.
 */
@RequiresRealBinary("edge-tts on PATH and network access")
class EdgeTtsSynthesisClientIntegrationTest {

    private EdgeTtsSynthesisClient client;

    @BeforeEach
    void setUp() {
        client = new EdgeTtsSynthesisClient(EdgeTtsConfig.defaults());
        assumeTrue(client.isHealthy(), "edge-tts not found on PATH. Install it with: pip install edge-tts");
    }

    @Test
    void shouldSynthesizeEnglish() {
        byte[] audio = client.synthesize("Hello world.", "en-US-ChristopherNeural");

        assertThat(audio).isNotEmpty();
    }

    @Test
    void shouldSynthesizeChinese() {
        byte[] audio = client.synthesize("你好，世界。", "zh-CN-XiaoxiaoNeural");

        assertThat(audio).isNotEmpty();
    }
}
