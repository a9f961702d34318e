package com.gridfacts.core.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the Grid Infrastructure home of the local host.
 *
 * <p>Sources are consulted in this order, the first hit wins:
 * <ol>
 *   <li>the explicitly configured home</li>
 *   <li>the {@code ORACLE_HOME} environment variable</li>
 *   <li>running clusterware daemons ({@code ohasd.bin}, {@code ocssd.bin}, {@code crsd.bin})
 *       found under {@code /proc}</li>
 *   <li>ASM or management database entries in {@code /etc/oratab}</li>
 * </ol>
 */
public class GridHomeLocator {

    private static final Logger log = LoggerFactory.getLogger(GridHomeLocator.class);

    public static final Path DEFAULT_PROC_ROOT = Paths.get("/proc");
    public static final Path DEFAULT_ORATAB = Paths.get("/etc/oratab");

    private static final Set<String> CLUSTERWARE_DAEMONS = Set.of("ohasd.bin", "ocssd.bin", "crsd.bin");
    private static final List<String> GRID_SID_PREFIXES = List.of("+ASM", "-MGMTDB");

    private final String explicitHome;
    private final Map<String, String> environment;
    private final Path procRoot;
    private final Path oratab;

    /**
     * Creates a locator.
     *
     * @param explicitHome configured home, or null
     * @param environment process environment
     * @param procRoot proc filesystem root
     * @param oratab oratab file
     */
    public GridHomeLocator(String explicitHome, Map<String, String> environment, Path procRoot, Path oratab) {
        this.explicitHome = explicitHome;
        this.environment = environment == null ? Map.of() : environment;
        this.procRoot = procRoot == null ? DEFAULT_PROC_ROOT : procRoot;
        this.oratab = oratab == null ? DEFAULT_ORATAB : oratab;
    }

    /**
     * Creates a locator for the current process environment and default system paths.
     *
     * @param explicitHome configured home, or null
     * @return locator
     */
    public static GridHomeLocator forCurrentHost(String explicitHome) {
        return new GridHomeLocator(explicitHome, System.getenv(), DEFAULT_PROC_ROOT, DEFAULT_ORATAB);
    }

    /**
     * Resolves the home.
     *
     * @return Grid Infrastructure home
     * @throws PreconditionFailedException if no source yields a home
     */
    public Path resolve() {
        return locate().orElseThrow(() -> new PreconditionFailedException(
            "Could not find Grid Infrastructure home: set ORACLE_HOME or pass --oracle-home"));
    }

    /**
     * Tries every source in order.
     *
     * @return home if found
     */
    public Optional<Path> locate() {
        if (isPresent(explicitHome)) {
            log.debug("Using configured home: {}", explicitHome);
            return Optional.of(Paths.get(explicitHome));
        }

        String fromEnv = environment.get("ORACLE_HOME");
        if (isPresent(fromEnv)) {
            log.debug("Using ORACLE_HOME from environment: {}", fromEnv);
            return Optional.of(Paths.get(fromEnv));
        }

        Optional<Path> fromProcesses = fromRunningDaemons();
        if (fromProcesses.isPresent()) {
            log.debug("Found home from running clusterware daemon: {}", fromProcesses.get());
            return fromProcesses;
        }

        Optional<Path> fromOratab = fromOratab();
        fromOratab.ifPresent(home -> log.debug("Found home in {}: {}", oratab, home));
        return fromOratab;
    }

    Optional<Path> fromRunningDaemons() {
        if (!Files.isDirectory(procRoot)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(procRoot)) {
            return entries
                .filter(dir -> dir.getFileName().toString().chars().allMatch(Character::isDigit))
                .map(dir -> dir.resolve("cmdline"))
                .map(GridHomeLocator::executableOf)
                .flatMap(Optional::stream)
                .filter(exe -> exe.getFileName() != null
                    && CLUSTERWARE_DAEMONS.contains(exe.getFileName().toString()))
                .map(exe -> exe.getParent() == null ? null : exe.getParent().getParent())
                .filter(Objects::nonNull)
                .findFirst();
        } catch (IOException e) {
            log.debug("Could not list {}: {}", procRoot, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<Path> fromOratab() {
        if (!Files.isReadable(oratab)) {
            return Optional.empty();
        }
        try {
            for (String line : Files.readAllLines(oratab, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] fields = trimmed.split(":");
                if (fields.length < 2 || fields[1].isBlank()) {
                    continue;
                }
                String sid = fields[0];
                if (GRID_SID_PREFIXES.stream().anyMatch(sid::startsWith)) {
                    return Optional.of(Paths.get(fields[1].trim()));
                }
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", oratab, e.getMessage());
        }
        return Optional.empty();
    }

    private static Optional<Path> executableOf(Path cmdline) {
        try {
            byte[] raw = Files.readAllBytes(cmdline);
            if (raw.length == 0) {
                return Optional.empty();
            }
            String argv0 = new String(raw, StandardCharsets.UTF_8).split("\0", 2)[0];
            return argv0.startsWith("/") ? Optional.of(Paths.get(argv0)) : Optional.empty();
        } catch (IOException | SecurityException e) {
            // process exited or belongs to another user
            return Optional.empty();
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
