/**
 * {@link com.phillippitts.bilingualtts.service.synthesis.SynthesisClient} implementation that shells
 * out to the {@code edge-tts} CLI. Configured via {@code tts.edge.*}.
 */
package com.phillippitts.bilingualtts.service.synthesis.edge;
