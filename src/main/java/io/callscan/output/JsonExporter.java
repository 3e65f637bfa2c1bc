package io.callscan.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.callscan.ScanResult;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Formats the function listing as JSON for machine processing.
 */
public class JsonExporter implements Exporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;
    private final Clock clock;

    public JsonExporter() {
        this(true, Clock.systemUTC());
    }

    public JsonExporter(boolean prettyPrint, Clock clock) {
        this.prettyPrint = prettyPrint;
        this.clock = clock;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(ScanResult result, Writer writer) throws IOException {
        JsonReport report = new JsonReport(
            result.index().modulePath(),
            Instant.now(clock),
            result.graph().nodeCount(),
            result.graph().edgeCount(),
            result.warnings().isEmpty() ? null : result.warnings().stream().map(Object::toString).toList(),
            FunctionRecord.all(result)
        );
        mapper.writer()
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .writeValue(writer, report);
        writer.flush();
    }

    /**
     * JSON structure of the export.
     */
    public record JsonReport(
        String modulePath,
        Instant generatedAt,
        int nodes,
        int edges,
        List<String> warnings,
        List<FunctionRecord> functions
    ) {}
}
