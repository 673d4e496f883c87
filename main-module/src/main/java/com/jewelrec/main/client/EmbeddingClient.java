package com.jewelrec.main.client;

import java.util.Optional;

/**
 * Multimodal embedding function. Vectors share one space for text and images.
 * An empty result means the input could not be embedded; transport failures raise
 * {@link com.jewelrec.common.exception.EmbeddingUnavailableException}.
 */
public interface EmbeddingClient {

    Optional<float[]> embedText(String text);

    Optional<float[]> embedImage(String imageBase64);
}
