package com.securehealth.model;

import java.time.Instant;

/**
 * One entry of a patient's note history.
 */
public record ClinicalNote(String content, String authorId, String authorName, Instant createdAt) {
}
