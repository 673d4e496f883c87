package com.jewelrec.main.embedding;

import com.jewelrec.common.exception.InvalidQueryException;
import com.jewelrec.common.math.VectorMath;
import com.jewelrec.main.client.EmbeddingClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns request inputs into a query vector: text only, image only, or an equal-weight
 * fusion of both. A precomputed vector bypasses the embedding service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryEmbedder {

    private static final double FUSION_WEIGHT = 0.5;

    private final EmbeddingClient embeddingClient;

    /**
     * @param vector      optional precomputed vector
     * @param text        optional query text
     * @param imageBase64 optional base64 image
     * @throws InvalidQueryException when nothing can be embedded
     */
    public EmbeddedQuery resolve(float[] vector, String text, String imageBase64) {
        String queryText = isBlank(text) ? null : text.trim();
        if (vector != null && vector.length > 0) {
            return new EmbeddedQuery(normalizeQuery(vector), queryText, !isBlank(imageBase64));
        }
        return embed(queryText, imageBase64);
    }

    public EmbeddedQuery embed(String text, String imageBase64) {
        boolean hasText = !isBlank(text);
        boolean hasImage = !isBlank(imageBase64);
        if (!hasText && !hasImage) {
            throw new InvalidQueryException("Query must contain text, an image or a vector");
        }

        Optional<float[]> textVector = hasText ? embeddingClient.embedText(text) : Optional.empty();
        Optional<float[]> imageVector = hasImage ? embeddingClient.embedImage(imageBase64) : Optional.empty();

        float[] fused;
        if (textVector.isPresent() && imageVector.isPresent()) {
            fused = VectorMath.weightedSum(
                normalizeQuery(textVector.get()), FUSION_WEIGHT,
                normalizeQuery(imageVector.get()), FUSION_WEIGHT);
            log.debug("Fused text and image embeddings");
        } else if (textVector.isPresent()) {
            fused = normalizeQuery(textVector.get());
        } else if (imageVector.isPresent()) {
            fused = normalizeQuery(imageVector.get());
        } else {
            throw new InvalidQueryException("Query could not be embedded");
        }
        return new EmbeddedQuery(fused, hasText ? text : null, imageVector.isPresent());
    }

    private static float[] normalizeQuery(float[] vector) {
        try {
            return VectorMath.normalize(vector);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Query vector must be non-zero and finite", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
