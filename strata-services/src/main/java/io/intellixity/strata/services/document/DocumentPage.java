package io.intellixity.strata.services.document;

import java.util.List;

/** One page of documents plus the total matching the filter. */
public record DocumentPage(List<Document> documents, long total) {
  public DocumentPage {
    documents = List.copyOf(documents);
  }

  public static DocumentPage empty() { return new DocumentPage(List.of(), 0); }
}
