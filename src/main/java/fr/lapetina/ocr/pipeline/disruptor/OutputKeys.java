package fr.lapetina.ocr.pipeline.disruptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Object store keys of the pipeline output.
 * Keys depend only on the work item id or the source path, so rewriting a batch
 * overwrites its previous output instead of duplicating it.
 */
public final class OutputKeys {

    public static final String RESULTS_PREFIX = "results/";
    public static final String MARKDOWN_PREFIX = "markdown/";

    private OutputKeys() {
    }

    public static String results(String workItemId) {
        return RESULTS_PREFIX + "output_" + workItemId + ".jsonl";
    }

    /**
     * Markdown key mirroring the source path: {@code /data/in/a.pdf} becomes
     * {@code markdown/data/in/a.md}.
     */
    public static String markdown(String sourceRef) {
        String normalized = sourceRef.replace('\\', '/');
        int scheme = normalized.indexOf("://");
        if (scheme >= 0) {
            normalized = normalized.substring(scheme + 3);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : normalized.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            // Keep keys inside the markdown prefix
            segments.add(segment.equals("..") ? "_" : segment.replace(':', '_'));
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Source reference has no file name: " + sourceRef);
        }

        int last = segments.size() - 1;
        String fileName = segments.get(last);
        int dot = fileName.lastIndexOf('.');
        if (dot > 0) {
            fileName = fileName.substring(0, dot);
        }
        segments.set(last, fileName + ".md");
        return MARKDOWN_PREFIX + String.join("/", segments);
    }
}
