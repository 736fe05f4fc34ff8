package com.agora.content;

import com.agora.exception.TransientContentException;

/**
 * Produces one short utterance for a persona.
 */
public interface ContentSource {

    /**
     * @throws TransientContentException when no usable text could be obtained
     */
    String generate(ContentRequest request);

    String name();
}
