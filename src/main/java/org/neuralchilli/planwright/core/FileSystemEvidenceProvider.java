package org.neuralchilli.planwright.core;

import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves deliverable references to files below a root directory.
 *
 * References containing glob characters must match exactly one regular file;
 * anything else is reported as ambiguous with the matched paths. References
 * that resolve outside the root are ambiguous as well. Markdown
 * task-list checkboxes ({@code - [x]} / {@code - [ ]}) in a deliverable are its
 * completion criteria.
 */
public class FileSystemEvidenceProvider implements EvidenceProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemEvidenceProvider.class);

    private static final Pattern CHECKBOX = Pattern.compile("^\\s*[-*+]\\s+\\[([ xX])]", Pattern.MULTILINE);
    private static final String GLOB_CHARACTERS = "*?[{";

    private final Path root;

    public FileSystemEvidenceProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public DeliverableProbe probe(ItemRef ref, WorkItem item) {
        String reference = item.deliverable();
        if (isGlob(reference)) {
            List<Path> matches = expand(reference);
            if (matches.size() != 1) {
                log.debug("{}: deliverable '{}' matched {} files", ref, reference, matches.size());
                return DeliverableProbe.ambiguous(reference, matches.stream().map(this::relative).toList());
            }
            return inspect(ref, reference, matches.get(0));
        }
        Path path = root.resolve(reference).normalize();
        if (!path.startsWith(root)) {
            log.warn("{}: deliverable '{}' points outside {}", ref, reference, root);
            return DeliverableProbe.ambiguous(reference, List.of());
        }
        return inspect(ref, reference, path);
    }

    private DeliverableProbe inspect(ItemRef ref, String reference, Path path) {
        if (Files.isDirectory(path)) {
            return DeliverableProbe.uninspectable(reference);
        }
        if (!Files.isRegularFile(path)) {
            return DeliverableProbe.absent(reference);
        }

        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // Unreadable content is reported, never guessed
            log.warn("{}: cannot read deliverable {}: {}", ref, path, e.getMessage());
            return DeliverableProbe.ambiguous(reference, List.of(relative(path)));
        }

        int total = 0;
        int satisfied = 0;
        Matcher matcher = CHECKBOX.matcher(content);
        while (matcher.find()) {
            total++;
            if (!matcher.group(1).isBlank()) {
                satisfied++;
            }
        }
        return DeliverableProbe.file(reference, content, total, satisfied);
    }

    private List<Path> expand(String pattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(root.relativize(p)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to expand deliverable pattern " + pattern, e);
        }
    }

    private String relative(Path path) {
        return path.startsWith(root) ? root.relativize(path).toString() : path.toString();
    }

    static boolean isGlob(String reference) {
        for (char c : GLOB_CHARACTERS.toCharArray()) {
            if (reference.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    public Path root() {
        return root;
    }
}
