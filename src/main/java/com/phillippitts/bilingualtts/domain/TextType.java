package com.phillippitts.bilingualtts.domain;

/**
 * Verdict of language classification over a whole text span.
 * {@link #MIXED} selects the run-splitting strategy.
 */
public enum TextType {
    ZH,
    EN,
    MIXED
}
