package fr.lapetina.ocr.pipeline.disruptor.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmax.disruptor.EventHandler;
import fr.lapetina.ocr.pipeline.disruptor.OutputKeys;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEvent;
import fr.lapetina.ocr.pipeline.domain.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * First stage handler: turns the documents of a batch into output bytes.
 *
 * Produces:
 * - One JSON line per document, in batch order
 * - One markdown file per document when markdown output is enabled
 */
public final class SerializationHandler implements EventHandler<BatchResultEvent> {

    private static final Logger log = LoggerFactory.getLogger(SerializationHandler.class);

    public static final String SOURCE = "page-ocr-pipeline";

    private final ObjectMapper objectMapper;
    private final boolean markdownEnabled;

    public SerializationHandler(ObjectMapper objectMapper, boolean markdownEnabled) {
        this.objectMapper = objectMapper;
        this.markdownEnabled = markdownEnabled;
    }

    @Override
    public void onEvent(BatchResultEvent event, long sequence, boolean endOfBatch) {
        if (event.isFailed()) {
            log.debug("Skipping failed event: sequence={}", sequence);
            return;
        }

        String workItemId = event.getWorkItem().id();
        try {
            ByteArrayOutputStream jsonl = new ByteArrayOutputStream();
            Map<String, byte[]> markdown = new LinkedHashMap<>();
            for (Document document : event.getDocuments()) {
                jsonl.writeBytes(objectMapper.writeValueAsBytes(toRecord(document)));
                jsonl.write('\n');
                if (markdownEnabled) {
                    markdown.put(OutputKeys.markdown(document.sourceRef()),
                            document.text().getBytes(StandardCharsets.UTF_8));
                }
            }
            event.markSerialized(OutputKeys.results(workItemId), jsonl.toByteArray(), markdown);

            log.debug("Batch serialized: workItemId={}, documents={}, bytes={}",
                    workItemId, event.getDocuments().size(), event.getJsonl().length);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Batch serialization failed: workItemId={}", workItemId, e);
            event.markFailed(e);
        }
    }

    ObjectNode toRecord(Document document) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put("id", document.id());
        record.put("text", document.text());
        record.put("source", SOURCE);
        String day = LocalDate.ofInstant(document.created(), ZoneOffset.UTC).toString();
        record.put("added", day);
        record.put("created", day);

        Document.Metadata metadata = document.metadata();
        ObjectNode meta = record.putObject("metadata");
        meta.put("Source-File", metadata.sourceFile());
        meta.put("pipeline-version", metadata.pipelineVersion());
        meta.put("pdf-total-pages", metadata.totalPages());
        meta.put("total-input-tokens", metadata.inputTokens());
        meta.put("total-output-tokens", metadata.outputTokens());
        meta.put("total-fallback-pages", metadata.fallbackPages());

        record.set("attributes", objectMapper.valueToTree(document.attributes()));
        return record;
    }
}
