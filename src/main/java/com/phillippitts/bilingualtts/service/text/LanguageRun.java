package com.phillippitts.bilingualtts.service.text;

import com.phillippitts.bilingualtts.domain.LanguageTag;

/**
 * A trimmed piece of text with the language it should be voiced in.
 */
record LanguageRun(String text, LanguageTag language) {
}
