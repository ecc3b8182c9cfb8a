package com.flamingo.ai.photostore.service.ingestion;

import com.flamingo.ai.photostore.domain.entity.BoundingBox;

/** One object reported by the external detector, before validation. */
public record RawObjectDetection(
    String classLabel, Integer classId, double confidence, BoundingBox box, String modelId) {}
