package fr.lapetina.ocr.pipeline.infrastructure.render;

import fr.lapetina.ocr.pipeline.domain.model.RenderedPage;

/**
 * Access to the pages of source documents. Page numbers are 1-based.
 * Implementations must allow concurrent calls.
 */
public interface PageSource {

    /**
     * @throws SourceDocumentException if the document cannot be opened
     */
    int pageCount(String documentRef);

    /**
     * Renders one page as PNG.
     *
     * @param targetLongestDim length in pixels of the longest image side
     * @param rotation         clockwise rotation to apply (0, 90, 180, 270)
     * @throws SourceDocumentException if the page cannot be rendered
     */
    RenderedPage render(String documentRef, int pageNumber, int targetLongestDim, int rotation);

    /**
     * Returns the embedded text layer of a page, or an empty string when there is none.
     *
     * @throws SourceDocumentException if the document cannot be read
     */
    String extractText(String documentRef, int pageNumber);
}
