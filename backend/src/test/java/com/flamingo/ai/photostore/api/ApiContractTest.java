package com.flamingo.ai.photostore.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.photostore.api.rest.HealthController;
import com.flamingo.ai.photostore.api.rest.KnownFaceController;
import com.flamingo.ai.photostore.api.rest.PhotoController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the controllers stay on their published paths:
 *
 * <ul>
 *   <li>POST /api/photos - Ingest a photo
 *   <li>GET /api/photos - List photos
 *   <li>GET /api/photos/{id} - Get photo metadata
 *   <li>DELETE /api/photos/{id} - Delete photo
 *   <li>GET /api/photos/search/{objects,faces,camera} - Searches
 *   <li>POST /api/faces - Enroll a known face
 *   <li>DELETE /api/faces/{id} - Delete a known face
 *   <li>GET /health/stats - Store statistics
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("PhotoController API contract")
  class PhotoControllerContract {

    @Test
    @DisplayName("should be mapped to /api/photos")
    void shouldBeMappedToApiPhotos() {
      RequestMapping mapping = PhotoController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/photos");
    }
  }

  @Nested
  @DisplayName("KnownFaceController API contract")
  class KnownFaceControllerContract {

    @Test
    @DisplayName("should be mapped to /api/faces")
    void shouldBeMappedToApiFaces() {
      RequestMapping mapping = KnownFaceController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/faces");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
