package com.jewelrec.main.embedding;

/**
 * A unit-normalized query vector together with what produced it.
 *
 * @param vector   unit vector
 * @param text     raw query text, used for attribute hints; may be null
 * @param hasImage whether an image contributed to the vector
 */
public record EmbeddedQuery(float[] vector, String text, boolean hasImage) {
}
