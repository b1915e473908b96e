package io.intellixity.strata.services.document;

import java.util.List;

/** Outcome of {@link DocumentService#createBatch}: created documents and per-index rejections. */
public record BatchResult(List<Document> created, List<ItemError> errors) {
  public BatchResult {
    created = List.copyOf(created);
    errors = List.copyOf(errors);
  }

  public record ItemError(int index, String error) {}
}
