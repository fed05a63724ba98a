package fr.lapetina.ocr.pipeline.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembled output for one source document.
 * The id is the SHA-1 of {@code text}, so identical output always gets the same id.
 */
public record Document(
        String id,
        String sourceRef,
        String text,
        List<PageSpan> pageSpans,
        Metadata metadata,
        Map<String, List<List<Object>>> attributes,
        Instant created
) {
    public Document {
        Objects.requireNonNull(id, "Document id is required");
        Objects.requireNonNull(sourceRef, "Source reference is required");
        Objects.requireNonNull(text, "Text is required");
        pageSpans = List.copyOf(pageSpans);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (created == null) {
            created = Instant.now();
        }
    }

    /**
     * Returns the page that produced the character at {@code offset}.
     */
    public Optional<Integer> pageAt(int offset) {
        return pageSpans.stream()
                .filter(span -> span.contains(offset))
                .map(PageSpan::pageNumber)
                .findFirst();
    }

    public boolean hasFallbackPages() {
        return metadata.fallbackPages() > 0;
    }

    /**
     * Whether every page fell back because the backend could not be reached.
     */
    public boolean lostToConnectivity() {
        return metadata.totalPages() > 0 && metadata.unreachablePages() == metadata.totalPages();
    }

    /**
     * Provenance and token accounting for a document.
     *
     * @param unreachablePages fallback pages whose last attempt failed to reach the backend
     */
    public record Metadata(
            String sourceFile,
            String pipelineVersion,
            int totalPages,
            long inputTokens,
            long outputTokens,
            int fallbackPages,
            int unreachablePages
    ) {
    }
}
