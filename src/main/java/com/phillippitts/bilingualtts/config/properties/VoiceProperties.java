package com.phillippitts.bilingualtts.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Voice table: caller-facing gender selector to per-language backend voice ids.
 *
 * <p>Example application.properties:
 * <pre>
 * tts.voices.default-gender=male
 * tts.voices.table.male.en=en-US-ChristopherNeural
 * tts.voices.table.male.zh=zh-CN-YunxiNeural
 * </pre>
 *
 * <p>Note: Bean created via {@link com.phillippitts.bilingualtts.BilingualTtsApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "tts.voices")
@Validated
public class VoiceProperties {

    /** Gender used when a request does not name one. */
    @NotBlank
    private String defaultGender = "male";

    @NotEmpty
    @Valid
    private Map<String, VoicePair> table = defaultTable();

    public String getDefaultGender() {
        return defaultGender;
    }

    public void setDefaultGender(String defaultGender) {
        this.defaultGender = defaultGender;
    }

    public Map<String, VoicePair> getTable() {
        return table;
    }

    public void setTable(Map<String, VoicePair> table) {
        this.table = table;
    }

    private static Map<String, VoicePair> defaultTable() {
        Map<String, VoicePair> voices = new LinkedHashMap<>();
        voices.put("male", new VoicePair("en-US-ChristopherNeural", "zh-CN-YunxiNeural"));
        voices.put("female", new VoicePair("en-US-JennyNeural", "zh-CN-XiaoxiaoNeural"));
        return voices;
    }

    /**
     * English and Chinese voice ids of one gender.
     */
    public static class VoicePair {
        @NotBlank
        private String en;
        @NotBlank
        private String zh;

        public VoicePair() {
        }

        public VoicePair(String en, String zh) {
            this.en = en;
            this.zh = zh;
        }

        public String getEn() {
            return en;
        }

        public void setEn(String en) {
            this.en = en;
        }

        public String getZh() {
            return zh;
        }

        public void setZh(String zh) {
            this.zh = zh;
        }
    }
}
