package com.flamingo.ai.photostore.domain.entity;

import com.flamingo.ai.photostore.domain.converter.EncodingConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One reference encoding of a named person.
 *
 * <p>A person enrolled from several images has several rows sharing the same {@link #name}. Rows
 * are keyed by {@link #imagePath} when one is given, so enrolling the same image again replaces
 * its encoding.
 */
@Entity
@Table(name = "known_faces")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnownFace {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 100)
  private String name;

  @Convert(converter = EncodingConverter.class)
  @Column(nullable = false, columnDefinition = "TEXT")
  private double[] encoding;

  @Column(name = "image_path", unique = true, length = 500)
  private String imagePath;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
