package com.flamingo.ai.photostore.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.config.PhotoStoreConfig;
import com.flamingo.ai.photostore.domain.entity.BoundingBox;
import com.flamingo.ai.photostore.domain.entity.FaceDetection;
import com.flamingo.ai.photostore.domain.entity.KnownFace;
import com.flamingo.ai.photostore.domain.entity.Photo;
import com.flamingo.ai.photostore.domain.repository.ClassCountView;
import com.flamingo.ai.photostore.domain.repository.ExifAttributesRepository;
import com.flamingo.ai.photostore.domain.repository.FaceDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.FaceSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.KnownFaceRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectDetectionRepository;
import com.flamingo.ai.photostore.domain.repository.ObjectSummaryRepository;
import com.flamingo.ai.photostore.domain.repository.PhotoRepository;
import com.flamingo.ai.photostore.exception.PhotoNotFoundException;
import com.flamingo.ai.photostore.exception.PhotoValidationException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

@ExtendWith(MockitoExtension.class)
class PhotoQueryServiceImplTest {

  @Mock private PhotoRepository photoRepository;
  @Mock private ExifAttributesRepository exifAttributesRepository;
  @Mock private ObjectDetectionRepository objectDetectionRepository;
  @Mock private ObjectSummaryRepository objectSummaryRepository;
  @Mock private FaceDetectionRepository faceDetectionRepository;
  @Mock private FaceSummaryRepository faceSummaryRepository;
  @Mock private KnownFaceRepository knownFaceRepository;

  private PhotoStoreConfig config;
  private PhotoQueryServiceImpl queryService;

  @BeforeEach
  void setUp() {
    config = new PhotoStoreConfig();
    queryService =
        new PhotoQueryServiceImpl(
            photoRepository,
            exifAttributesRepository,
            objectDetectionRepository,
            objectSummaryRepository,
            faceDetectionRepository,
            faceSummaryRepository,
            knownFaceRepository,
            config);
  }

  @Nested
  @DisplayName("searchByObjects")
  class SearchByObjects {

    @Test
    @DisplayName("should require every distinct class to match")
    @SuppressWarnings("unchecked")
    void shouldPassDistinctClassCount() {
      when(objectSummaryRepository.findPhotoIdsContainingAll(any(), eq(2), eq(2L)))
          .thenReturn(List.of(1L, 4L));

      List<Long> result =
          queryService.searchByObjects(Arrays.asList("person", " car ", "person", "", null), 2);

      assertThat(result).containsExactly(1L, 4L);
      ArgumentCaptor<Collection<String>> captor = ArgumentCaptor.forClass(Collection.class);
      verify(objectSummaryRepository).findPhotoIdsContainingAll(captor.capture(), eq(2), eq(2L));
      assertThat(captor.getValue()).containsExactlyInAnyOrder("person", "car");
    }

    @Test
    void shouldRejectEmptyClassSet() {
      assertThatThrownBy(() -> queryService.searchByObjects(List.of(" "), 1))
          .isInstanceOf(PhotoValidationException.class)
          .hasMessageContaining("class");
      verifyNoInteractions(objectSummaryRepository);
    }

    @Test
    void shouldRejectMinCountBelowOne() {
      assertThatThrownBy(() -> queryService.searchByObjects(List.of("person"), 0))
          .isInstanceOf(PhotoValidationException.class)
          .hasMessageContaining("minCount");
    }
  }

  @Nested
  @DisplayName("searchByFaces")
  class SearchByFaces {

    @Test
    void shouldQueryTrimmedNames() {
      when(faceDetectionRepository.findPhotoIdsMatchingAnyName(Set.of("John_Doe", "Jane_Smith")))
          .thenReturn(List.of(2L, 3L));

      assertThat(queryService.searchByFaces(List.of("John_Doe ", "Jane_Smith")))
          .containsExactly(2L, 3L);
    }

    @Test
    void shouldRejectNullNames() {
      assertThatThrownBy(() -> queryService.searchByFaces(null))
          .isInstanceOf(PhotoValidationException.class);
    }
  }

  @Nested
  @DisplayName("searchByCamera")
  class SearchByCamera {

    @Test
    void shouldMatchMakeAndModel() {
      when(exifAttributesRepository.findPhotoIdsByCameraMakeAndModel("Canon", "EOS R5"))
          .thenReturn(List.of(8L));

      assertThat(queryService.searchByCamera(" Canon", "EOS R5")).containsExactly(8L);
    }

    @Test
    void shouldMatchMakeOnly() {
      when(exifAttributesRepository.findPhotoIdsByCameraMake("Canon")).thenReturn(List.of(8L));

      assertThat(queryService.searchByCamera("Canon", " ")).containsExactly(8L);
    }

    @Test
    void shouldMatchModelOnly() {
      when(exifAttributesRepository.findPhotoIdsByCameraModel("iPhone 14"))
          .thenReturn(List.of(1L));

      assertThat(queryService.searchByCamera(null, "iPhone 14")).containsExactly(1L);
    }

    @Test
    void shouldRequireMakeOrModel() {
      assertThatThrownBy(() -> queryService.searchByCamera(null, ""))
          .isInstanceOf(PhotoValidationException.class);
    }
  }

  @Nested
  @DisplayName("getPhotoInfo")
  class GetPhotoInfo {

    @Test
    void shouldResolveMatchedNames() {
      Photo photo = Photo.builder().id(1L).filePath("/p.jpg").fileName("p.jpg").build();
      FaceDetection recognized =
          FaceDetection.builder()
              .id(10L)
              .photoId(1L)
              .knownFaceId(3L)
              .box(BoundingBox.pixels(0, 0, 5, 5))
              .build();
      FaceDetection unknown =
          FaceDetection.builder().id(11L).photoId(1L).box(BoundingBox.pixels(0, 0, 5, 5)).build();
      when(photoRepository.findById(1L)).thenReturn(Optional.of(photo));
      when(faceDetectionRepository.findByPhotoIdOrderByIdAsc(1L))
          .thenReturn(List.of(recognized, unknown));
      when(knownFaceRepository.findAllById(Set.of(3L)))
          .thenReturn(List.of(KnownFace.builder().id(3L).name("John_Doe").build()));
      when(exifAttributesRepository.findByPhotoId(1L)).thenReturn(Optional.empty());
      when(objectDetectionRepository.findByPhotoIdOrderByIdAsc(1L)).thenReturn(List.of());
      when(objectSummaryRepository.findByPhotoIdOrderByClassLabelAsc(1L)).thenReturn(List.of());
      when(faceSummaryRepository.findByPhotoId(1L)).thenReturn(Optional.empty());

      PhotoDetail detail = queryService.getPhotoInfo(1L);

      assertThat(detail.photo()).isSameAs(photo);
      assertThat(detail.exif()).isNull();
      assertThat(detail.matchedName(recognized)).isEqualTo("John_Doe");
      assertThat(detail.matchedName(unknown)).isNull();
    }

    @Test
    void shouldFailForUnknownPhoto() {
      when(photoRepository.findById(5L)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> queryService.getPhotoInfo(5L))
          .isInstanceOf(PhotoNotFoundException.class);
      verify(faceDetectionRepository, never()).findByPhotoIdOrderByIdAsc(anyLong());
    }
  }

  @Test
  @DisplayName("getStatistics should combine aggregate counts")
  void shouldComputeStatistics() {
    config.getQuery().setTopClassesLimit(3);
    when(photoRepository.count()).thenReturn(12L);
    when(objectDetectionRepository.count()).thenReturn(40L);
    when(exifAttributesRepository.countWithGps()).thenReturn(5L);
    when(faceDetectionRepository.count()).thenReturn(9L);
    when(faceDetectionRepository.countByKnownFaceIdIsNotNull()).thenReturn(6L);
    when(knownFaceRepository.count()).thenReturn(4L);
    when(knownFaceRepository.countDistinctNames()).thenReturn(2L);
    when(objectSummaryRepository.findTopClasses(PageRequest.of(0, 3)))
        .thenReturn(List.of(classCount("person", 25L), classCount("car", 10L)));

    StoreStatistics stats = queryService.getStatistics();

    assertThat(stats.getTotalPhotos()).isEqualTo(12L);
    assertThat(stats.getTotalObjectDetections()).isEqualTo(40L);
    assertThat(stats.getPhotosWithGps()).isEqualTo(5L);
    assertThat(stats.getRecognizedFaces()).isEqualTo(6L);
    assertThat(stats.getUnrecognizedFaces()).isEqualTo(3L);
    assertThat(stats.getKnownIdentities()).isEqualTo(2L);
    assertThat(stats.getTopClasses()).hasSize(2);
    assertThat(stats.getTopClasses().get(0).getClassLabel()).isEqualTo("person");
    assertThat(stats.getTopClasses().get(0).getCount()).isEqualTo(25L);
  }

  @Nested
  @DisplayName("listPhotos")
  class ListPhotos {

    @Test
    void shouldOrderByIdAndCapPageSize() {
      config.getQuery().setMaxPageSize(50);
      Page<Photo> empty = new PageImpl<>(List.of());
      when(photoRepository.findAll(any(Pageable.class))).thenReturn(empty);

      queryService.listPhotos(2, 500);

      ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
      verify(photoRepository).findAll(captor.capture());
      Pageable pageable = captor.getValue();
      assertThat(pageable.getPageNumber()).isEqualTo(2);
      assertThat(pageable.getPageSize()).isEqualTo(50);
      assertThat(pageable.getSort()).isEqualTo(Sort.by(Sort.Direction.ASC, "id"));
    }

    @Test
    void shouldRejectNegativePage() {
      assertThatThrownBy(() -> queryService.listPhotos(-1, 10))
          .isInstanceOf(PhotoValidationException.class);
    }

    @Test
    void shouldRejectZeroSize() {
      assertThatThrownBy(() -> queryService.listPhotos(0, 0))
          .isInstanceOf(PhotoValidationException.class);
      verify(photoRepository, never()).findAll(any(Pageable.class));
    }
  }

  private static ClassCountView classCount(String label, Long total) {
    return new ClassCountView() {
      @Override
      public String getClassLabel() {
        return label;
      }

      @Override
      public Long getTotal() {
        return total;
      }
    };
  }
}
