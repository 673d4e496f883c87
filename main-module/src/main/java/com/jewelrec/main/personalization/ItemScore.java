package com.jewelrec.main.personalization;

/** A collaborative recommendation: item key and accumulated score. */
public record ItemScore(String itemId, double score) {
}
