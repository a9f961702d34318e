package com.gridfacts.core.host;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Paths of the clusterware tools inside a Grid Infrastructure home.
 *
 * @param home Grid Infrastructure home
 * @param srvctl {@code home/bin/srvctl}
 * @param crsctl {@code home/bin/crsctl}
 * @param cemutlo {@code home/bin/cemutlo}
 * @param olsnodes {@code home/bin/olsnodes}
 */
public record GridTools(
    Path home,
    Path srvctl,
    Path crsctl,
    Path cemutlo,
    Path olsnodes
) {
    /**
     * Compact constructor with validation.
     */
    public GridTools {
        Objects.requireNonNull(home, "home must not be null");
        Objects.requireNonNull(srvctl, "srvctl must not be null");
        Objects.requireNonNull(crsctl, "crsctl must not be null");
        Objects.requireNonNull(cemutlo, "cemutlo must not be null");
        Objects.requireNonNull(olsnodes, "olsnodes must not be null");
    }

    /**
     * Derives the tool paths from a home directory.
     *
     * @param home Grid Infrastructure home
     * @return tool paths (not verified)
     */
    public static GridTools forHome(Path home) {
        Path bin = home.resolve("bin");
        return new GridTools(
            home,
            bin.resolve("srvctl"),
            bin.resolve("crsctl"),
            bin.resolve("cemutlo"),
            bin.resolve("olsnodes")
        );
    }

    /**
     * Checks that every tool is an executable regular file.
     *
     * @return this instance
     * @throws PreconditionFailedException naming the first tool that is missing or not executable
     */
    public GridTools verify() {
        for (Path tool : List.of(srvctl, crsctl, cemutlo, olsnodes)) {
            if (!Files.isRegularFile(tool) || !Files.isExecutable(tool)) {
                throw new PreconditionFailedException(
                    "Not an executable file: " + tool + " (is " + home + " a Grid Infrastructure home?)");
            }
        }
        return this;
    }
}
