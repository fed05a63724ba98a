package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.domain.model.PageSpan;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Stitches the page results of one document into a {@link Document}.
 *
 * <p>Pages are joined in ascending page order with a newline after every page
 * but the last. Each page span owns its text and its trailing newline, so the
 * spans are sorted, gap-free and cover the whole text. Fallback pages are kept;
 * a document is built whatever the number of fallbacks.
 */
public final class DocumentBuilder {

    public static final String PAGE_NUMBERS = "pdf_page_numbers";
    public static final String PRIMARY_LANGUAGE = "primary_language";
    public static final String ROTATION_VALID = "is_rotation_valid";
    public static final String ROTATION_CORRECTION = "rotation_correction";
    public static final String TABLE = "is_table";
    public static final String DIAGRAM = "is_diagram";
    public static final String FALLBACK = "is_fallback";

    private final String pipelineVersion;
    private final Clock clock;

    public DocumentBuilder(String pipelineVersion, Clock clock) {
        this.pipelineVersion = pipelineVersion;
        this.clock = clock;
    }

    /**
     * @param pageResults exactly one result per page, pages 1..n in any order
     * @throws IllegalArgumentException if a page is missing or duplicated
     */
    public Document build(String sourceRef, List<PageResult> pageResults) {
        List<PageResult> pages = new ArrayList<>(pageResults);
        pages.sort(Comparator.comparingInt(PageResult::pageNumber));
        for (int i = 0; i < pages.size(); i++) {
            if (pages.get(i).pageNumber() != i + 1) {
                throw new IllegalArgumentException("Expected page " + (i + 1) + " of " + sourceRef
                        + " but found page " + pages.get(i).pageNumber());
            }
        }

        StringBuilder text = new StringBuilder();
        List<PageSpan> spans = new ArrayList<>(pages.size());
        long inputTokens = 0;
        long outputTokens = 0;
        int fallbackPages = 0;
        int unreachablePages = 0;

        for (int i = 0; i < pages.size(); i++) {
            PageResult page = pages.get(i);
            int start = text.length();
            text.append(page.text());
            if (i < pages.size() - 1) {
                text.append('\n');
            }
            spans.add(new PageSpan(start, text.length(), page.pageNumber()));

            inputTokens += page.inputTokens();
            outputTokens += page.outputTokens();
            if (page.fallback()) {
                fallbackPages++;
            }
            if (page.lostToConnectivity()) {
                unreachablePages++;
            }
        }

        Map<String, List<List<Object>>> attributes = new LinkedHashMap<>();
        attributes.put(PAGE_NUMBERS, spanValues(spans, pages, PageResult::pageNumber));
        attributes.put(PRIMARY_LANGUAGE, spanValues(spans, pages, PageResult::primaryLanguage));
        attributes.put(ROTATION_VALID, spanValues(spans, pages, PageResult::rotationValid));
        attributes.put(ROTATION_CORRECTION, spanValues(spans, pages, PageResult::rotationCorrection));
        attributes.put(TABLE, spanValues(spans, pages, PageResult::table));
        attributes.put(DIAGRAM, spanValues(spans, pages, PageResult::diagram));
        attributes.put(FALLBACK, spanValues(spans, pages, PageResult::fallback));

        String finalText = text.toString();
        Document.Metadata metadata = new Document.Metadata(
                sourceRef, pipelineVersion, pages.size(), inputTokens, outputTokens, fallbackPages, unreachablePages);

        return new Document(sha1(finalText), sourceRef, finalText, spans, metadata, attributes, clock.instant());
    }

    private static List<List<Object>> spanValues(
            List<PageSpan> spans,
            List<PageResult> pages,
            Function<PageResult, Object> value
    ) {
        List<List<Object>> values = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            PageSpan span = spans.get(i);
            values.add(Arrays.asList(span.start(), span.end(), value.apply(pages.get(i))));
        }
        return values;
    }

    static String sha1(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
