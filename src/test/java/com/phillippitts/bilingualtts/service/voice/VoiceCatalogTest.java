package com.phillippitts.bilingualtts.service.voice;

import com.phillippitts.bilingualtts.config.properties.VoiceProperties;
import com.phillippitts.bilingualtts.domain.LanguageTag;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceCatalogTest {

    private final VoiceCatalog catalog = new VoiceCatalog(new VoiceProperties());

    @Test
    void defaultTableHasMaleAndFemale() {
        assertThat(catalog.genders()).containsExactlyInAnyOrder("male", "female");
        assertThat(catalog.defaultGender()).isEqualTo("male");
    }

    @Test
    void blankSelectorUsesDefault() {
        VoiceProfile profile = catalog.profileFor(null);

        assertThat(profile.gender()).isEqualTo("male");
        assertThat(profile.voiceFor(LanguageTag.EN)).isEqualTo("en-US-ChristopherNeural");
        assertThat(profile.voiceFor(LanguageTag.ZH)).isEqualTo("zh-CN-YunxiNeural");
        assertThat(catalog.profileFor(" ")).isEqualTo(profile);
    }

    @Test
    void selectorIsCaseInsensitive() {
        VoiceProfile profile = catalog.profileFor(" Female ");

        assertThat(profile.voiceFor(LanguageTag.EN)).isEqualTo("en-US-JennyNeural");
        assertThat(profile.voiceFor(LanguageTag.ZH)).isEqualTo("zh-CN-XiaoxiaoNeural");
    }

    @Test
    void unknownSelectorIsInvalidInput() {
        assertThatThrownBy(() -> catalog.profileFor("robot"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("unknown voice 'robot'");
    }

    @Test
    void customTableIsHonored() {
        VoiceProperties props = new VoiceProperties();
        props.setTable(Map.of("Narrator", new VoiceProperties.VoicePair("en-GB-RyanNeural", "zh-CN-YunyangNeural")));
        props.setDefaultGender("narrator");

        VoiceCatalog custom = new VoiceCatalog(props);

        assertThat(custom.profileFor("NARRATOR").voiceFor(LanguageTag.EN)).isEqualTo("en-GB-RyanNeural");
    }

    @Test
    void defaultMissingFromTableFailsAtStartup() {
        VoiceProperties props = new VoiceProperties();
        props.setDefaultGender("child");

        assertThatThrownBy(() -> new VoiceCatalog(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("child");
    }
}
