package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Character range {@code [start, end)} of the document text produced by one page.
 */
public record PageSpan(int start, int end, int pageNumber) {

    public PageSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
