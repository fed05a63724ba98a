package fr.lapetina.ocr.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * A durable batch of document references leased by one worker at a time.
 * Never mutated after creation.
 */
public record WorkItem(String id, List<String> documentRefs) {

    @JsonCreator
    public WorkItem(
            @JsonProperty("id") String id,
            @JsonProperty("documentRefs") List<String> documentRefs
    ) {
        Objects.requireNonNull(id, "Work item id is required");
        if (documentRefs == null || documentRefs.isEmpty()) {
            throw new IllegalArgumentException("Work item needs at least one document");
        }
        this.id = id;
        this.documentRefs = List.copyOf(documentRefs);
    }

    /**
     * Creates a work item whose id is derived from its (sorted) references,
     * so the same batch always maps to the same id.
     */
    public static WorkItem of(List<String> documentRefs) {
        return new WorkItem(computeId(documentRefs), documentRefs);
    }

    static String computeId(List<String> documentRefs) {
        List<String> sorted = new ArrayList<>(documentRefs);
        sorted.sort(null);
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            for (String ref : sorted) {
                sha1.update(ref.getBytes(StandardCharsets.UTF_8));
                sha1.update((byte) '\n');
            }
            return HexFormat.of().formatHex(sha1.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public int size() {
        return documentRefs.size();
    }
}
