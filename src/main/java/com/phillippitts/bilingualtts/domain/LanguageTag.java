package com.phillippitts.bilingualtts.domain;

/**
 * Resolved language of a single {@link Segment}.
 *
 * <p>Only two values exist: a segment is always voiced by exactly one voice. Mixed input is
 * a classification verdict ({@link TextType#MIXED}), never a segment's final tag.
 */
public enum LanguageTag {
    ZH,
    EN
}
