package fr.lapetina.ocr.pipeline.domain.event;

import java.util.List;

/**
 * What the writer pipeline stored for one batch.
 *
 * @param outputKey    key of the JSONL object
 * @param markdownKeys keys of the Markdown objects, empty when Markdown output is off
 */
public record BatchWriteResult(
        String workItemId,
        String outputKey,
        List<String> markdownKeys,
        int documents,
        long bytesWritten
) {
    public BatchWriteResult {
        markdownKeys = List.copyOf(markdownKeys);
    }
}
