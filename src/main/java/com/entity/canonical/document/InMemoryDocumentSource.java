package com.entity.canonical.document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Document source held in memory, ordered by id.
 */
public class InMemoryDocumentSource implements DocumentSource {

    private final Map<String, SourceDocument> documents = new ConcurrentHashMap<>();

    public InMemoryDocumentSource() {
    }

    public InMemoryDocumentSource(Collection<SourceDocument> initial) {
        initial.forEach(this::add);
    }

    public InMemoryDocumentSource add(SourceDocument document) {
        documents.put(document.id(), document);
        return this;
    }

    @Override
    public List<SourceDocument> list(String dataset, String documentId) {
        return new ArrayList<>(documents.values()).stream()
                .filter(d -> dataset == null || dataset.equals(d.dataset()))
                .filter(d -> documentId == null || documentId.equals(d.id()))
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .collect(Collectors.toList());
    }

    public int size() {
        return documents.size();
    }
}
