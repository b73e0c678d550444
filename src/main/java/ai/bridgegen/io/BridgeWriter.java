package ai.bridgegen.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.bridgegen.ast.ItemPrinter;
import ai.bridgegen.convert.ConversionResult;
import ai.bridgegen.model.EncounteredType;

/**
 * Writes a conversion result:
 * - bridge.rs: rewritten items as source
 * - types.jsonl / needs.jsonl: one record per line
 * - index.json: file names and counts
 */
public final class BridgeWriter {

    public static final String SCHEMA_VERSION = "bridge-gen/v1";

    public static final String BRIDGE_FILE = "bridge.rs";
    public static final String TYPES_FILE = "types.jsonl";
    public static final String NEEDS_FILE = "needs.jsonl";
    public static final String INDEX_FILE = "index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public BridgeWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonlMapper = new ObjectMapper();
    }

    public void writeAll(ConversionResult result, String generatedAt) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);

        Files.writeString(outDir.resolve(BRIDGE_FILE), ItemPrinter.render(result.items()), StandardCharsets.UTF_8);
        writeJsonl(outDir.resolve(TYPES_FILE), result.typesToDisable());
        writeJsonl(outDir.resolve(NEEDS_FILE), result.additionalNeeds());

        int structs = 0;
        int enums = 0;
        for (EncounteredType t : result.typesToDisable()) {
            if (t.kind() == EncounteredType.Kind.STRUCT) {
                structs++;
            } else {
                enums++;
            }
        }

        final Summary summary = new Summary(
                result.items().size(),
                result.bridgeModule().items().size(),
                structs,
                enums,
                result.additionalNeeds().size()
        );

        final MasterIndex idx = new MasterIndex(
                SCHEMA_VERSION,
                generatedAt,
                BRIDGE_FILE,
                TYPES_FILE,
                NEEDS_FILE,
                summary
        );

        writeJson(outDir.resolve(INDEX_FILE), idx);
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        // overwrite each time (simple + deterministic)
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            String bridge,
            String types,
            String needs,
            Summary summary
    ) {
    }

    public record Summary(
            int items,
            int bridgeItems,
            int structs,
            int enums,
            int needs
    ) {
    }
}
