package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.domain.TextType;
import org.springframework.stereotype.Component;

/**
 * Classifies a text span as Chinese, English or mixed.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>blank text is {@link TextType#EN}</li>
 *   <li>a bare number ({@code 42}, {@code 3.5}, {@code 50%}) is {@link TextType#EN}</li>
 *   <li>CJK ideographs or CJK punctuation together with Latin letters is {@link TextType#MIXED}</li>
 *   <li>CJK without Latin letters is {@link TextType#ZH}</li>
 *   <li>anything else is {@link TextType#EN}</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class LanguageClassifier {

    public TextType classify(String text) {
        if (text == null || text.isBlank()) {
            return TextType.EN;
        }
        String trimmed = text.strip();
        if (TextCharacters.isNumeric(trimmed)) {
            return TextType.EN;
        }
        boolean cjk = false;
        boolean latin = false;
        for (int i = 0; i < trimmed.length() && !(cjk && latin); i++) {
            char c = trimmed.charAt(i);
            cjk |= TextCharacters.isCjk(c);
            latin |= TextCharacters.isLatinLetter(c);
        }
        if (cjk && latin) {
            return TextType.MIXED;
        }
        return cjk ? TextType.ZH : TextType.EN;
    }
}
