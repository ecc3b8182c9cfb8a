package com.flamingo.ai.photostore.domain.repository;

/** Projection of a class label with its summed detection count. */
public interface ClassCountView {

  String getClassLabel();

  Long getTotal();
}
