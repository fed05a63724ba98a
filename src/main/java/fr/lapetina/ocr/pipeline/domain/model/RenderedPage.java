package fr.lapetina.ocr.pipeline.domain.model;

import java.util.Base64;
import java.util.Objects;

/**
 * PNG raster of one page.
 */
public record RenderedPage(int pageNumber, byte[] png, int width, int height) {

    public RenderedPage {
        Objects.requireNonNull(png, "PNG bytes are required");
    }

    public String base64Png() {
        return Base64.getEncoder().encodeToString(png);
    }
}
