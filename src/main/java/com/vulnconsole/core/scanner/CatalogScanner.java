package com.vulnconsole.core.scanner;

import com.vulnconsole.core.ConsoleProperties;
import com.vulnconsole.core.model.CatalogSnapshot;
import com.vulnconsole.core.model.EnvironmentDescriptor;
import com.vulnconsole.core.model.EnvironmentStatus;
import com.vulnconsole.core.model.ExploitFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks the environment catalog and builds {@link EnvironmentDescriptor}s.
 * <p>
 * The catalog is laid out as {@code <root>/<category>/<environment>/docker-compose.yml}.
 * Only those two levels are visited, which also bounds the walk when symlinks
 * form cycles. The scanner never touches the container runtime: descriptors
 * come back with {@code status=unknown} and {@code has_images=false}, and the
 * reconciliation engine fills both in with batched runtime queries.
 * <p>
 * Two entry points differ in cost:
 * <ul>
 *   <li>{@link #fingerprint(Path)} lists directories and stats composition files</li>
 *   <li>{@link #scan(Path)} additionally parses every composition file and looks
 *       for exploits, READMEs and screenshots</li>
 * </ul>
 */
@Service
public class CatalogScanner {

    private static final Logger log = LoggerFactory.getLogger(CatalogScanner.class);

    /** Recognised composition file names, in lookup priority. */
    static final List<String> COMPOSE_FILE_NAMES = List.of(
            "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml"
    );

    private static final int USAGE_SCAN_LINES = 20;
    private static final Set<String> EXPLOIT_DIRS = Set.of("exploit", "exploits", "poc", "pocs");

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(
            ".py", ".sh", ".rb", ".go", ".c", ".cpp", ".pl", ".php", ".java", ".js"
    );

    private static final Set<String> SCREENSHOT_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".webp", ".bmp", ".svg"
    );

    private static final List<String> README_ZH_NAMES = List.of(
            "README.zh-cn.md", "README.zh-CN.md", "README_zh.md"
    );

    private static final int PROGRESS_INTERVAL = 50;

    private final ComposeFileParser parser;
    private final int maxScreenshots;
    private final Clock clock;

    @Autowired
    public CatalogScanner(ComposeFileParser parser, ConsoleProperties properties) {
        this(parser, properties.getMaxScreenshots(), Clock.systemUTC());
    }

    public CatalogScanner() {
        this(new ComposeFileParser(), 3, Clock.systemUTC());
    }

    CatalogScanner(ComposeFileParser parser, int maxScreenshots, Clock clock) {
        this.parser = parser;
        this.maxScreenshots = maxScreenshots;
        this.clock = clock;
    }

    /**
     * Performs a full scan of the catalog.
     *
     * @param catalogRoot the catalog root directory
     * @return a snapshot whose fingerprint matches {@link #fingerprint(Path)} for the same tree
     */
    public CatalogSnapshot scan(Path catalogRoot) {
        Path root = catalogRoot.toAbsolutePath().normalize();
        List<CatalogEntry> entries = listEntries(root);
        log.info("Found {} environments under {}, scanning...", entries.size(), root);

        var descriptors = new ArrayList<EnvironmentDescriptor>(entries.size());
        Instant now = clock.instant();
        int scanned = 0;
        for (CatalogEntry entry : entries) {
            descriptors.add(describe(entry, now));
            scanned++;
            if (scanned % PROGRESS_INTERVAL == 0) {
                log.info("Scanned {}/{} environments", scanned, entries.size());
            }
        }
        log.info("Scan complete: {} environments", descriptors.size());
        return CatalogSnapshot.of(fingerprintOf(entries), now, root.toString(), descriptors);
    }

    /**
     * Computes the catalog fingerprint from the directory listing and the
     * composition files' size and modification time only.
     */
    public String fingerprint(Path catalogRoot) {
        return fingerprintOf(listEntries(catalogRoot.toAbsolutePath().normalize()));
    }

    /**
     * Lists every environment directory, ordered by id. Unreadable directories
     * are logged and skipped.
     */
    public List<CatalogEntry> listEntries(Path catalogRoot) {
        var entries = new ArrayList<CatalogEntry>();
        for (Path categoryDir : childDirectories(catalogRoot)) {
            for (Path environmentDir : childDirectories(categoryDir)) {
                toEntry(catalogRoot, environmentDir).ifPresent(entries::add);
            }
        }
        entries.sort(Comparator.comparing(CatalogEntry::id));
        return entries;
    }

    /**
     * Resolves an environment id to its catalog entry. Ids that escape the catalog
     * root, are not exactly {@code <category>/<environment>}, or do not point at a
     * directory with a composition file resolve to empty.
     */
    public Optional<CatalogEntry> entryFor(Path catalogRoot, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Path root = catalogRoot.toAbsolutePath().normalize();
        Path dir = root.resolve(id).normalize();
        if (!dir.startsWith(root) || root.relativize(dir).getNameCount() != 2 || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        return toEntry(root, dir);
    }

    /**
     * Builds the descriptor for one entry. Composition parse failures degrade the
     * entry instead of failing the scan.
     */
    public EnvironmentDescriptor describe(CatalogEntry entry, Instant checkedAt) {
        ComposeDefinition compose;
        boolean parseError = false;
        try {
            compose = parser.parse(entry.composeFile());
        } catch (CompositionParseException e) {
            log.warn("Cannot parse {}: {}", entry.composeFile(), e.getMessage());
            compose = ComposeDefinition.empty();
            parseError = true;
        }

        Path dir = entry.directory();
        List<String> exploits = exploitFiles(dir);
        return new EnvironmentDescriptor(
                entry.id(),
                entry.category(),
                entry.cve(),
                compose.publishedPorts(),
                compose.serviceNames(),
                compose.images(),
                !exploits.isEmpty(),
                exploits,
                false,
                EnvironmentStatus.UNKNOWN,
                entry.contentSignature(),
                parseError,
                Files.isRegularFile(dir.resolve("README.md")),
                README_ZH_NAMES.stream().anyMatch(name -> Files.isRegularFile(dir.resolve(name))),
                screenshots(dir),
                checkedAt,
                null
        );
    }

    /**
     * Parses the composition file of one entry without building a descriptor.
     */
    public ComposeDefinition compose(CatalogEntry entry) {
        return parser.parse(entry.composeFile());
    }

    /**
     * Reads the composition file of one entry as text.
     *
     * @return the text, or empty when the file cannot be read
     */
    public Optional<String> composeText(CatalogEntry entry) {
        try {
            return Optional.of(Files.readString(entry.composeFile(), StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot read {}: {}", entry.composeFile(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads every recognised exploit script of one entry. Empty and unreadable
     * files are left out.
     */
    public List<ExploitFile> exploits(CatalogEntry entry) {
        var result = new ArrayList<ExploitFile>();
        for (String relativePath : exploitFiles(entry.directory())) {
            Path file = entry.directory().resolve(relativePath);
            String content;
            try {
                content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Cannot read exploit {}: {}", file, e.getMessage());
                continue;
            }
            if (content.isEmpty()) continue;
            List<String> lines = content.lines().toList();
            String usage = lines.stream()
                    .limit(USAGE_SCAN_LINES)
                    .filter(line -> {
                        String lower = line.toLowerCase(Locale.ROOT);
                        return lower.contains("usage:") || lower.contains("example:");
                    })
                    .map(String::strip)
                    .findFirst()
                    .orElse("");
            result.add(new ExploitFile(
                    file.getFileName().toString(),
                    relativePath,
                    content.length() > ExploitFile.MAX_CONTENT_CHARS
                            ? content.substring(0, ExploitFile.MAX_CONTENT_CHARS)
                            : content,
                    content.length(),
                    lines.size(),
                    usage));
        }
        return result;
    }

    /**
     * Returns recognised exploit scripts relative to {@code environmentDir}, sorted.
     * A file counts when it is a script under an exploit/poc subdirectory, or a
     * first-level script whose name mentions "exploit" or "poc", or is {@code exp.py}.
     */
    List<String> exploitFiles(Path environmentDir) {
        var found = new ArrayList<String>();
        for (String sub : EXPLOIT_DIRS) {
            Path subDir = environmentDir.resolve(sub);
            if (!Files.isDirectory(subDir)) continue;
            try (Stream<Path> files = Files.walk(subDir, 2)) {
                files.filter(Files::isRegularFile)
                     .filter(p -> isScript(p.getFileName().toString()))
                     .forEach(p -> found.add(relative(environmentDir, p)));
            } catch (IOException | RuntimeException e) {
                log.warn("Cannot list exploit directory {}: {}", subDir, e.getMessage());
            }
        }
        for (Path file : childFiles(environmentDir)) {
            String name = file.getFileName().toString();
            String lower = name.toLowerCase(Locale.ROOT);
            if (isScript(name) && (lower.contains("exploit") || lower.contains("poc") || lower.equals("exp.py"))) {
                found.add(name);
            }
        }
        found.sort(null);
        return found;
    }

    private List<String> screenshots(Path environmentDir) {
        return childFiles(environmentDir).stream()
                .map(p -> p.getFileName().toString())
                .filter(name -> SCREENSHOT_EXTENSIONS.contains(extensionOf(name)))
                .sorted()
                .limit(maxScreenshots)
                .toList();
    }

    private Optional<CatalogEntry> toEntry(Path root, Path environmentDir) {
        for (String name : COMPOSE_FILE_NAMES) {
            Path composeFile = environmentDir.resolve(name);
            if (!Files.isRegularFile(composeFile)) continue;
            try {
                BasicFileAttributes attrs = Files.readAttributes(composeFile, BasicFileAttributes.class);
                String signature = attrs.size() + "-" + attrs.lastModifiedTime().toMillis();
                String id = relative(root, environmentDir);
                String[] segments = id.split("/");
                return Optional.of(new CatalogEntry(id, segments[0], segments[segments.length - 1],
                        environmentDir, composeFile, signature));
            } catch (IOException e) {
                log.warn("Cannot stat {}, skipping environment: {}", composeFile, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static List<Path> childDirectories(Path dir) {
        var children = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (!child.getFileName().toString().startsWith(".") && Files.isDirectory(child)) {
                    children.add(child);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.warn("Cannot read directory {}, skipping: {}", dir, e.getMessage());
        }
        children.sort(null);
        return children;
    }

    private static List<Path> childFiles(Path dir) {
        var children = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (Files.isRegularFile(child)) {
                    children.add(child);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.warn("Cannot read directory {}: {}", dir, e.getMessage());
        }
        return children;
    }

    static String fingerprintOf(List<CatalogEntry> entries) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (CatalogEntry entry : entries) {
                digest.update(entry.id().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\t');
                digest.update(entry.contentSignature().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean isScript(String fileName) {
        return SCRIPT_EXTENSIONS.contains(extensionOf(fileName));
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String relative(Path base, Path path) {
        return base.relativize(path).toString().replace('\\', '/');
    }
}
