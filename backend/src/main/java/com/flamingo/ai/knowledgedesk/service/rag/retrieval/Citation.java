package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

/**
 * A source document an answer was grounded on.
 *
 * @param collection the collection the document belongs to
 * @param path source path, unique within the collection
 * @param title display title, may be null
 * @param url link back to the source, may be null
 * @param score best similarity of any of the document's chunks used
 */
public record Citation(String collection, String path, String title, String url, double score) {

  /** Two citations refer to the same document when collection and path match. */
  public String documentKey() {
    return collection + ":" + path;
  }
}
