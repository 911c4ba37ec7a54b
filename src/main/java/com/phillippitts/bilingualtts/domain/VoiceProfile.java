package com.phillippitts.bilingualtts.domain;

import java.util.Objects;

/**
 * Caller-selected voice mapping from segment language to backend voice identifier.
 *
 * @param gender       selector the profile was resolved from (e.g. "male")
 * @param englishVoice voice id used for {@link LanguageTag#EN} segments
 * @param chineseVoice voice id used for {@link LanguageTag#ZH} segments
 */
public record VoiceProfile(String gender, String englishVoice, String chineseVoice) {

    public VoiceProfile {
        Objects.requireNonNull(gender, "gender must not be null");
        Objects.requireNonNull(englishVoice, "englishVoice must not be null");
        Objects.requireNonNull(chineseVoice, "chineseVoice must not be null");
    }

    public String voiceFor(LanguageTag language) {
        return switch (language) {
            case EN -> englishVoice;
            case ZH -> chineseVoice;
        };
    }
}
