package com.forecastplatform.common.port;

import reactor.core.publisher.Mono;

/**
 * Free-text generation for forecast narratives. Treated as a black box: any
 * failure is recovered by the caller with a fallback sentence.
 */
public interface NarrativeGenerator {

    /**
     * @param prompt fully rendered prompt
     * @return generated text; may complete empty or with an error
     */
    Mono<String> generate(String prompt);
}
