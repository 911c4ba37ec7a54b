/**
 * Language detection and segmentation of input text.
 *
 * <p>Everything here is a pure function of the text and the segmentation properties:
 * {@link com.phillippitts.bilingualtts.service.text.TextChunker} produces positioned lines,
 * {@link com.phillippitts.bilingualtts.service.text.Segmenter} turns each line into ordered
 * single-language segments using one of three splitting strategies chosen by
 * {@link com.phillippitts.bilingualtts.service.text.LanguageClassifier}.
 */
package com.phillippitts.bilingualtts.service.text;
