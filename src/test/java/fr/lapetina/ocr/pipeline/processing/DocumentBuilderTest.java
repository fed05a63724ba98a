package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.PageResponse;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.domain.model.PageSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentBuilderTest {

    private final DocumentBuilder builder = new DocumentBuilder("1.0.0",
            Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));

    private static PageResult accepted(int page, String text) {
        return PageResult.accepted(page, new PageResponse("en", true, 0, false, false, text), 100, 20, 1);
    }

    @Test
    @DisplayName("should join pages in order with gap-free spans covering the text")
    void shouldBuildSpans() {
        Document document = builder.build("/a.pdf", List.of(
                accepted(3, "third"), accepted(1, "first"), accepted(2, "second")));

        assertThat(document.text()).isEqualTo("first\nsecond\nthird");
        assertThat(document.pageSpans()).containsExactly(
                new PageSpan(0, 6, 1), new PageSpan(6, 13, 2), new PageSpan(13, 18, 3));
        assertThat(document.pageAt(7)).contains(2);
        assertThat(document.metadata().inputTokens()).isEqualTo(300);
        assertThat(document.created()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("should derive the id from the text content")
    void shouldUseContentHashAsId() {
        Document one = builder.build("/a.pdf", List.of(accepted(1, "same")));
        Document two = builder.build("/b.pdf", List.of(accepted(1, "same")));

        assertThat(one.id()).isEqualTo(two.id()).isEqualTo(DocumentBuilder.sha1("same"));
    }

    @Test
    @DisplayName("should keep fallback pages and count connectivity losses")
    void shouldCountFallbacks() {
        Document document = builder.build("/a.pdf", List.of(
                accepted(1, "ok"),
                PageResult.fallback(2, "", "NETWORK_ERROR: refused", ErrorType.NETWORK_ERROR, 4)));

        assertThat(document.metadata().fallbackPages()).isEqualTo(1);
        assertThat(document.metadata().unreachablePages()).isEqualTo(1);
        assertThat(document.lostToConnectivity()).isFalse();
        assertThat(document.attributes().get(DocumentBuilder.FALLBACK))
                .containsExactly(List.of(0, 3, false), List.of(3, 3, true));
    }

    @Test
    @DisplayName("should reject missing or duplicated pages")
    void shouldRejectIncompletePages() {
        assertThatThrownBy(() -> builder.build("/a.pdf", List.of(accepted(1, "a"), accepted(3, "c"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build("/a.pdf", List.of(accepted(1, "a"), accepted(1, "b"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
