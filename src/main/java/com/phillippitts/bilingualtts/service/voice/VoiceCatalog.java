package com.phillippitts.bilingualtts.service.voice;

import com.phillippitts.bilingualtts.config.properties.VoiceProperties;
import com.phillippitts.bilingualtts.domain.VoiceProfile;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves a caller's voice selector ({@code male}, {@code female}, ...) to a {@link VoiceProfile}.
 *
 * <p>The table is copied once at startup; lookups are case-insensitive.
 */
@Component
public class VoiceCatalog {

    private final Map<String, VoiceProfile> profiles;
    private final String defaultGender;

    public VoiceCatalog(VoiceProperties properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, VoiceProfile> table = new LinkedHashMap<>();
        properties.getTable().forEach((gender, pair) -> {
            String key = normalize(gender);
            table.put(key, new VoiceProfile(key, pair.getEn(), pair.getZh()));
        });
        this.profiles = Collections.unmodifiableMap(table);
        this.defaultGender = normalize(properties.getDefaultGender());
        if (!profiles.containsKey(defaultGender)) {
            throw new IllegalStateException("Default voice '" + defaultGender + "' is not in the voice table "
                    + profiles.keySet());
        }
    }

    /**
     * @param gender voice selector; null or blank selects the default
     * @throws InvalidInputException if the selector is not in the table
     */
    public VoiceProfile profileFor(String gender) {
        if (gender == null || gender.isBlank()) {
            return profiles.get(defaultGender);
        }
        VoiceProfile profile = profiles.get(normalize(gender));
        if (profile == null) {
            throw new InvalidInputException("unknown voice '" + gender + "', expected one of " + profiles.keySet());
        }
        return profile;
    }

    public Set<String> genders() {
        return profiles.keySet();
    }

    public String defaultGender() {
        return defaultGender;
    }

    private static String normalize(String gender) {
        return gender == null ? "" : gender.strip().toLowerCase(Locale.ROOT);
    }
}
