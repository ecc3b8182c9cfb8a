package com.flamingo.ai.photostore.service.ingestion;

import com.flamingo.ai.photostore.config.PhotoStoreConfig;
import com.flamingo.ai.photostore.domain.entity.BoundingBox;
import com.flamingo.ai.photostore.domain.enums.BoxUnits;
import com.flamingo.ai.photostore.exception.PhotoValidationException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Checks ingestion and enrollment input before anything is written. */
@Component
@RequiredArgsConstructor
public class IngestionValidator {

  static final int MAX_PATH_LENGTH = 500;
  static final int MAX_LABEL_LENGTH = 100;
  static final int MAX_FORMAT_LENGTH = 50;
  static final int MAX_MODEL_LENGTH = 100;

  private final PhotoStoreConfig config;

  /**
   * Validates one photo's payload.
   *
   * @throws PhotoValidationException on the first violation found
   */
  public void validatePhoto(
      String filePath,
      FileMetadata fileMetadata,
      List<RawObjectDetection> objectDetections,
      List<RawFaceDetection> faceDetections) {
    validatePath(filePath);

    if (fileMetadata != null) {
      requireNonNegative(filePath, "File size", fileMetadata.sizeBytes());
      requireNonNegative(filePath, "Image width", fileMetadata.width());
      requireNonNegative(filePath, "Image height", fileMetadata.height());
      requireMaxLength(filePath, "File format", fileMetadata.format(), MAX_FORMAT_LENGTH);
      requireMaxLength(
          filePath, "Processing model", fileMetadata.processingModel(), MAX_MODEL_LENGTH);
    }

    if (objectDetections != null) {
      for (int i = 0; i < objectDetections.size(); i++) {
        validateObject(filePath, i, objectDetections.get(i));
      }
    }
    if (faceDetections != null) {
      for (int i = 0; i < faceDetections.size(); i++) {
        validateFace(filePath, i, faceDetections.get(i));
      }
    }
  }

  /** Validates a known-face enrollment. */
  public void validateEnrollment(String name, double[] encoding, String sourceImagePath) {
    if (name == null || name.isBlank()) {
      throw new PhotoValidationException("Known face name must not be blank");
    }
    if (name.length() > MAX_LABEL_LENGTH) {
      throw new PhotoValidationException("Known face name is too long: " + name.length());
    }
    if (encoding == null) {
      throw new PhotoValidationException("Known face encoding is required");
    }
    validateEncoding(null, "Known face", encoding);
    if (sourceImagePath != null && sourceImagePath.length() > MAX_PATH_LENGTH) {
      throw new PhotoValidationException("Source image path is too long");
    }
  }

  /** Validates a photo path used as an upsert or lookup key. */
  public void validatePath(String filePath) {
    if (filePath == null || filePath.isBlank()) {
      throw new PhotoValidationException("File path must not be blank");
    }
    if (filePath.length() > MAX_PATH_LENGTH) {
      throw new PhotoValidationException(
          "File path exceeds " + MAX_PATH_LENGTH + " characters: " + filePath.length());
    }
  }

  private void validateObject(String filePath, int index, RawObjectDetection detection) {
    String label = "Object detection " + index;
    if (detection == null) {
      throw new PhotoValidationException(filePath, label + " is null");
    }
    if (detection.classLabel() == null || detection.classLabel().isBlank()) {
      throw new PhotoValidationException(filePath, label + " has a blank class label");
    }
    if (detection.classLabel().length() > MAX_LABEL_LENGTH) {
      throw new PhotoValidationException(filePath, label + " has a class label that is too long");
    }
    requireUnitInterval(filePath, label + " confidence", detection.confidence());
    validateBox(filePath, label, detection.box());
    requireMaxLength(filePath, label + " model ID", detection.modelId(), MAX_MODEL_LENGTH);
  }

  private void validateFace(String filePath, int index, RawFaceDetection detection) {
    String label = "Face detection " + index;
    if (detection == null) {
      throw new PhotoValidationException(filePath, label + " is null");
    }
    validateBox(filePath, label, detection.box());
    if (detection.encoding() != null) {
      validateEncoding(filePath, label, detection.encoding());
    }
    if (detection.matchConfidence() != null) {
      requireUnitInterval(filePath, label + " match confidence", detection.matchConfidence());
    }
    if (detection.matchedName() != null && detection.matchedName().length() > MAX_LABEL_LENGTH) {
      throw new PhotoValidationException(filePath, label + " has a matched name that is too long");
    }
    requireMaxLength(filePath, label + " model ID", detection.modelId(), MAX_MODEL_LENGTH);
  }

  private void validateBox(String filePath, String label, BoundingBox box) {
    if (box == null) {
      throw new PhotoValidationException(filePath, label + " has no bounding box");
    }
    if (box.getUnits() == null) {
      throw new PhotoValidationException(filePath, label + " bounding box has no units");
    }
    double[] values = {box.getX(), box.getY(), box.getWidth(), box.getHeight()};
    for (double value : values) {
      if (!Double.isFinite(value) || value < 0) {
        throw new PhotoValidationException(
            filePath, label + " bounding box must be finite and non-negative");
      }
      if (box.getUnits() == BoxUnits.NORMALIZED && value > 1.0) {
        throw new PhotoValidationException(
            filePath, label + " normalized bounding box must lie within [0, 1]");
      }
    }
  }

  private void validateEncoding(String filePath, String label, double[] encoding) {
    int expected = config.getFace().getEncodingLength();
    if (encoding.length != expected) {
      throw new PhotoValidationException(
          filePath,
          String.format(
              "%s encoding has length %d, expected %d", label, encoding.length, expected));
    }
    for (double value : encoding) {
      if (!Double.isFinite(value)) {
        throw new PhotoValidationException(
            filePath, label + " encoding contains a non-finite value");
      }
    }
  }

  private void requireUnitInterval(String filePath, String what, double value) {
    if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
      throw new PhotoValidationException(filePath, what + " must be within [0, 1]: " + value);
    }
  }

  private void requireMaxLength(String filePath, String what, String value, int max) {
    if (value != null && value.length() > max) {
      throw new PhotoValidationException(
          filePath, what + " exceeds " + max + " characters: " + value.length());
    }
  }

  private void requireNonNegative(String filePath, String what, Number value) {
    if (value != null && value.longValue() < 0) {
      throw new PhotoValidationException(filePath, what + " must not be negative: " + value);
    }
  }
}
