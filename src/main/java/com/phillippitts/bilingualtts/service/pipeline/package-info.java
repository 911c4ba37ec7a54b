/**
 * The text-to-audio pipeline: segmentation, bounded concurrent dispatch, ordering and assembly.
 *
 * @see com.phillippitts.bilingualtts.service.pipeline.DefaultPipelineOrchestrator
 */
package com.phillippitts.bilingualtts.service.pipeline;
