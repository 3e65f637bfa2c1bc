package io.callscan.output;

import io.callscan.ScanResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a scan result in a file format.
 */
public interface Exporter {

    /**
     * Returns the format name (e.g., "csv", "json", "dot").
     */
    String format();

    void write(ScanResult result, Writer writer) throws IOException;

    default void write(ScanResult result, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }

    default String toString(ScanResult result) {
        try {
            StringWriter writer = new StringWriter();
            write(result, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + format() + " output", e);
        }
    }
}
