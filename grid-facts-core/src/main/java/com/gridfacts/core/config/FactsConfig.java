package com.gridfacts.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridfacts.core.command.ProcessCommandRunner;
import com.gridfacts.core.host.GridHomeLocator;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration loaded from {@code gridfacts.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * oracleHome: /u01/app/19.0.0/grid
 * oratab: /etc/oratab
 * commandTimeoutSeconds: 30
 * output:
 *   format: json
 *   file: /tmp/gi_facts.json
 * }</pre>
 *
 * @param oracleHome Grid Infrastructure home; null to locate it automatically
 * @param oratab oratab file consulted when locating the home
 * @param procRoot proc filesystem consulted when locating the home
 * @param commandTimeoutSeconds per-command timeout
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FactsConfig(
    @JsonProperty("oracleHome") String oracleHome,
    @JsonProperty("oratab") String oratab,
    @JsonProperty("procRoot") String procRoot,
    @JsonProperty("commandTimeoutSeconds") Integer commandTimeoutSeconds,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Creates the configuration used when no file is present.
     *
     * @return default configuration
     */
    public static FactsConfig defaults() {
        return new FactsConfig(
            null,
            GridHomeLocator.DEFAULT_ORATAB.toString(),
            GridHomeLocator.DEFAULT_PROC_ROOT.toString(),
            (int) ProcessCommandRunner.DEFAULT_TIMEOUT.toSeconds(),
            new OutputConfig("json", null)
        );
    }

    /**
     * Returns the command timeout, falling back to the default for missing or non-positive values.
     *
     * @return timeout
     */
    public Duration commandTimeout() {
        if (commandTimeoutSeconds == null || commandTimeoutSeconds <= 0) {
            return ProcessCommandRunner.DEFAULT_TIMEOUT;
        }
        return Duration.ofSeconds(commandTimeoutSeconds);
    }

    public Path oratabPath() {
        return oratab == null || oratab.isBlank() ? GridHomeLocator.DEFAULT_ORATAB : Paths.get(oratab);
    }

    public Path procRootPath() {
        return procRoot == null || procRoot.isBlank() ? GridHomeLocator.DEFAULT_PROC_ROOT : Paths.get(procRoot);
    }

    /**
     * Returns the configured output format, or {@code json}.
     *
     * @return renderer id
     */
    public String outputFormat() {
        return output == null || output.format() == null ? "json" : output.format();
    }

    /**
     * Output configuration.
     *
     * @param format renderer id ({@code json} or {@code console})
     * @param file file to write to; null for standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("file") String file
    ) {}
}
