package fr.lapetina.ocr.pipeline.infrastructure.render;

import fr.lapetina.ocr.pipeline.domain.model.RenderedPage;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Page source for local PDF files and single-page raster images (PNG, JPEG),
 * backed by Apache PDFBox.
 *
 * <p>Each call opens the document on its own, so concurrent calls never share
 * a {@link PDDocument}.
 */
public final class PdfBoxPageSource implements PageSource {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageSource.class);

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};
    private static final float POINTS_PER_INCH = 72f;

    @Override
    public int pageCount(String documentRef) {
        Path path = resolve(documentRef);
        if (!isPdf(path)) {
            readImage(documentRef, path);
            return 1;
        }
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            int pages = document.getNumberOfPages();
            if (pages < 1) {
                throw new SourceDocumentException(documentRef, "PDF has no pages");
            }
            return pages;
        } catch (IOException e) {
            throw new SourceDocumentException(documentRef, "Unreadable PDF", e);
        }
    }

    @Override
    public RenderedPage render(String documentRef, int pageNumber, int targetLongestDim, int rotation) {
        Path path = resolve(documentRef);
        BufferedImage image = isPdf(path)
                ? renderPdfPage(documentRef, path, pageNumber, targetLongestDim)
                : scale(singlePage(documentRef, path, pageNumber), targetLongestDim);

        BufferedImage rotated = rotate(image, rotation);
        byte[] png = toPng(documentRef, rotated);
        log.debug("Page rendered: documentRef={}, page={}, width={}, height={}, rotation={}, bytes={}",
                documentRef, pageNumber, rotated.getWidth(), rotated.getHeight(), rotation, png.length);
        return new RenderedPage(pageNumber, png, rotated.getWidth(), rotated.getHeight());
    }

    @Override
    public String extractText(String documentRef, int pageNumber) {
        Path path = resolve(documentRef);
        if (!isPdf(path)) {
            return "";
        }
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            checkPage(documentRef, document, pageNumber);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            return stripper.getText(document);
        } catch (IOException e) {
            throw new SourceDocumentException(documentRef, "Text extraction failed on page " + pageNumber, e);
        }
    }

    private BufferedImage renderPdfPage(String documentRef, Path path, int pageNumber, int targetLongestDim) {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            checkPage(documentRef, document, pageNumber);
            PDPage page = document.getPage(pageNumber - 1);
            PDRectangle box = page.getCropBox();
            float longestSide = Math.max(box.getWidth(), box.getHeight());
            float dpi = targetLongestDim * POINTS_PER_INCH / longestSide;

            PDFRenderer renderer = new PDFRenderer(document);
            return renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.RGB);
        } catch (IOException e) {
            throw new SourceDocumentException(documentRef, "Rendering failed on page " + pageNumber, e);
        }
    }

    private BufferedImage singlePage(String documentRef, Path path, int pageNumber) {
        if (pageNumber != 1) {
            throw new SourceDocumentException(documentRef, "Image documents have a single page, requested " + pageNumber);
        }
        return readImage(documentRef, path);
    }

    private BufferedImage readImage(String documentRef, Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new SourceDocumentException(documentRef, "Unsupported image format");
            }
            return image;
        } catch (IOException e) {
            throw new SourceDocumentException(documentRef, "Unreadable image", e);
        }
    }

    private static void checkPage(String documentRef, PDDocument document, int pageNumber) {
        if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
            throw new SourceDocumentException(documentRef,
                    "Page " + pageNumber + " out of range 1.." + document.getNumberOfPages());
        }
    }

    static BufferedImage scale(BufferedImage source, int targetLongestDim) {
        int longest = Math.max(source.getWidth(), source.getHeight());
        if (longest == targetLongestDim) {
            return source;
        }
        double factor = (double) targetLongestDim / longest;
        int width = Math.max(1, (int) Math.round(source.getWidth() * factor));
        int height = Math.max(1, (int) Math.round(source.getHeight() * factor));

        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    static BufferedImage rotate(BufferedImage source, int rotation) {
        if (rotation == 0) {
            return source;
        }
        boolean quarterTurn = rotation == 90 || rotation == 270;
        int width = quarterTurn ? source.getHeight() : source.getWidth();
        int height = quarterTurn ? source.getWidth() : source.getHeight();

        AffineTransform transform = new AffineTransform();
        transform.translate(width / 2.0, height / 2.0);
        transform.rotate(Math.toRadians(rotation));
        transform.translate(-source.getWidth() / 2.0, -source.getHeight() / 2.0);

        BufferedImage rotated = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rotated.createGraphics();
        try {
            g.drawImage(source, transform, null);
        } finally {
            g.dispose();
        }
        return rotated;
    }

    private static byte[] toPng(String documentRef, BufferedImage image) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new SourceDocumentException(documentRef, "PNG encoding failed", e);
        }
    }

    private static Path resolve(String documentRef) {
        Path path = Path.of(documentRef);
        if (!Files.isRegularFile(path)) {
            throw new SourceDocumentException(documentRef, "Source document not found");
        }
        return path;
    }

    private static boolean isPdf(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(PDF_MAGIC.length);
            return Arrays.equals(head, PDF_MAGIC);
        } catch (IOException e) {
            throw new SourceDocumentException(path.toString(), "Unreadable source document", e);
        }
    }
}
