package fr.lapetina.ocr.pipeline;

import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Expands configured source selectors into document references.
 *
 * A selector is a file, a directory (searched recursively for supported
 * documents) or a glob pattern such as {@code /data/**}{@code /*.pdf}.
 */
public final class SourceResolver {

    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "png", "jpg", "jpeg");

    private SourceResolver() {
    }

    /**
     * @return absolute, de-duplicated references in lexicographic order
     * @throws ConfigurationException if a selector cannot be read
     */
    public static List<String> resolve(List<String> selectors) {
        Set<String> refs = new TreeSet<>();
        for (String selector : selectors) {
            int before = refs.size();
            if (isGlob(selector)) {
                expandGlob(selector, refs);
            } else {
                Path path = Path.of(selector).toAbsolutePath().normalize();
                if (Files.isDirectory(path)) {
                    walk(path, SourceResolver::isSupported, refs);
                } else if (Files.isRegularFile(path)) {
                    refs.add(path.toString());
                } else {
                    log.warn("Source not found: selector={}", selector);
                }
            }
            log.info("Source resolved: selector={}, documents={}", selector, refs.size() - before);
        }
        return new ArrayList<>(refs);
    }

    /**
     * Splits references into consecutive batches of at most {@code batchSize}.
     */
    public static List<List<String>> batches(List<String> refs, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < refs.size(); i += batchSize) {
            batches.add(List.copyOf(refs.subList(i, Math.min(refs.size(), i + batchSize))));
        }
        return batches;
    }

    private static void expandGlob(String pattern, Set<String> refs) {
        String normalized = pattern.replace('\\', '/');
        int firstGlob = firstGlobIndex(normalized);
        int lastSlash = normalized.lastIndexOf('/', firstGlob);
        String base = lastSlash < 0 ? "." : (lastSlash == 0 ? "/" : normalized.substring(0, lastSlash));

        Path root = Path.of(base).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.warn("Glob base directory not found: pattern={}, base={}", pattern, root);
            return;
        }
        String absolutePattern = lastSlash < 0
                ? root.resolve(normalized).toString()
                : root + normalized.substring(lastSlash);
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + absolutePattern);
        walk(root, matcher, refs);
    }

    private static void walk(Path root, PathMatcher filter, Set<String> refs) {
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(filter::matches)
                    .map(Path::toString)
                    .forEach(refs::add);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read source directory: " + root, e);
        }
    }

    static boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean isGlob(String selector) {
        return firstGlobIndex(selector) < selector.length();
    }

    private static int firstGlobIndex(String selector) {
        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return i;
            }
        }
        return selector.length();
    }
}
