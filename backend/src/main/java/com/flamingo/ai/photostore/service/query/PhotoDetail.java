package com.flamingo.ai.photostore.service.query;

import com.flamingo.ai.photostore.domain.entity.ExifAttributes;
import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import com.flamingo.ai.photostore.domain.entity.FaceSummary;
import com.flamingo.ai.photostore.domain.entity.ObjectDetection;
import com.flamingo.ai.photostore.domain.entity.ObjectSummary;
import com.flamingo.ai.photostore.domain.entity.Photo;
import java.util.List;
import java.util.Map;

/**
 * Everything stored for one photo.
 *
 * @param exif EXIF attributes, null when the photo had none
 * @param knownFaceNames names of the known faces referenced by {@code faces}, keyed by ID
 * @param faceSummary face counts, null only for photos written before summaries existed
 */
public record PhotoDetail(
    Photo photo,
    ExifAttributes exif,
    List<ObjectDetection> objects,
    List<ObjectSummary> objectSummaries,
    List<FaceDetection> faces,
    Map<Long, String> knownFaceNames,
    FaceSummary faceSummary) {

  /** Returns the matched name of a face, or null when it is unrecognized. */
  public String matchedName(FaceDetection face) {
    return face.getKnownFaceId() != null ? knownFaceNames.get(face.getKnownFaceId()) : null;
  }
}
