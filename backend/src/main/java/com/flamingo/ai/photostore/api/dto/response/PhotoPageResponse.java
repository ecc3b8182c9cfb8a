package com.flamingo.ai.photostore.api.dto.response;

import com.flamingo.ai.photostore.domain.entity.Photo;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

/** One page of photos, ordered by ID. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhotoPageResponse {

  private List<PhotoResponse> photos;
  private int page;
  private int size;
  private long totalElements;
  private int totalPages;

  public static PhotoPageResponse fromPage(Page<Photo> page) {
    return PhotoPageResponse.builder()
        .photos(page.getContent().stream().map(PhotoResponse::fromEntity).toList())
        .page(page.getNumber())
        .size(page.getSize())
        .totalElements(page.getTotalElements())
        .totalPages(page.getTotalPages())
        .build();
  }
}
