package com.gridfacts.core.renderer;

import com.gridfacts.core.model.ClusterFacts;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes collected {@link ClusterFacts} somewhere.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.gridfacts.core.renderer.FactsRenderer}
 */
public interface FactsRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used as the value of {@code --format}. Should be lowercase (e.g., "json", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Formats the facts.
     *
     * @param facts collected facts
     * @param context rendering settings
     * @return rendered text
     */
    String format(ClusterFacts facts, RenderContext context);

    /**
     * Formats the facts and writes them to the context's output file, or standard output.
     *
     * @param facts collected facts
     * @param context rendering settings
     * @throws UncheckedIOException if the output file cannot be written
     */
    default void render(ClusterFacts facts, RenderContext context) {
        String text = format(facts, context);
        Path outputFile = context.outputFile();
        if (outputFile == null) {
            System.out.println(text);
            return;
        }
        try {
            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            Files.writeString(outputFile, text + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + outputFile, e);
        }
    }
}
