package com.entity.canonical.document;

import java.util.Objects;

/**
 * A document whose text has already been extracted upstream.
 *
 * @param id      stable document id
 * @param dataset dataset or collection the document belongs to, may be null
 * @param path    original location, for logs
 * @param text    full text, may be null when extraction produced nothing
 */
public record SourceDocument(String id, String dataset, String path, String text) {

    public SourceDocument {
        Objects.requireNonNull(id, "id is required");
    }
}
