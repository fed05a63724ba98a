package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.infrastructure.render.PageSource;
import fr.lapetina.ocr.pipeline.infrastructure.render.SourceDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes every page of one document and assembles the result.
 *
 * <p>Pages run through at most {@code maxConcurrentPages} lanes. Each lane takes
 * the next unprocessed page number when its previous page resolves, so no more
 * than that many pages are ever in flight for the document.
 */
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final PageSource pageSource;
    private final PageProcessor pageProcessor;
    private final DocumentBuilder documentBuilder;
    private final int maxConcurrentPages;

    public DocumentProcessor(
            PageSource pageSource,
            PageProcessor pageProcessor,
            DocumentBuilder documentBuilder,
            int maxConcurrentPages
    ) {
        if (maxConcurrentPages < 1) {
            throw new IllegalArgumentException("maxConcurrentPages must be >= 1");
        }
        this.pageSource = pageSource;
        this.pageProcessor = pageProcessor;
        this.documentBuilder = documentBuilder;
        this.maxConcurrentPages = maxConcurrentPages;
    }

    /**
     * Processes a whole document.
     *
     * @return future of the assembled document; fails with {@link SourceDocumentException}
     *         when the source cannot be opened
     */
    public CompletableFuture<Document> process(String documentRef) {
        int pageCount;
        try {
            pageCount = pageSource.pageCount(documentRef);
        } catch (SourceDocumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Processing document: documentRef={}, pages={}", documentRef, pageCount);
        PageResult[] results = new PageResult[pageCount];
        AtomicInteger nextPage = new AtomicInteger(1);
        int lanes = Math.min(maxConcurrentPages, pageCount);

        List<CompletableFuture<Void>> laneFutures = new ArrayList<>(lanes);
        for (int i = 0; i < lanes; i++) {
            laneFutures.add(runLane(documentRef, pageCount, nextPage, results));
        }

        return CompletableFuture.allOf(laneFutures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Document document = documentBuilder.build(documentRef, Arrays.asList(results));
                    log.info("Document assembled: documentRef={}, pages={}, fallbackPages={}, chars={}",
                            documentRef, pageCount, document.metadata().fallbackPages(), document.text().length());
                    return document;
                });
    }

    private CompletableFuture<Void> runLane(
            String documentRef,
            int pageCount,
            AtomicInteger nextPage,
            PageResult[] results
    ) {
        CompletableFuture<Void> lane = new CompletableFuture<>();
        advanceLane(lane, documentRef, pageCount, nextPage, results);
        return lane;
    }

    /**
     * Takes pages until one is still pending, then resumes from its completion.
     * Pages that resolve immediately (forced shutdown) are consumed in this loop
     * so the stack stays flat however many pages the document has.
     */
    private void advanceLane(
            CompletableFuture<Void> lane,
            String documentRef,
            int pageCount,
            AtomicInteger nextPage,
            PageResult[] results
    ) {
        while (true) {
            int page = nextPage.getAndIncrement();
            if (page > pageCount) {
                lane.complete(null);
                return;
            }
            CompletableFuture<PageResult> pageFuture = pageProcessor.process(documentRef, page);
            if (!pageFuture.isDone()) {
                pageFuture.whenComplete((result, ex) -> {
                    if (ex != null) {
                        lane.completeExceptionally(ex);
                        return;
                    }
                    results[page - 1] = result;
                    advanceLane(lane, documentRef, pageCount, nextPage, results);
                });
                return;
            }
            try {
                results[page - 1] = pageFuture.join();
            } catch (CompletionException | CancellationException e) {
                lane.completeExceptionally(e);
                return;
            }
        }
    }
}
