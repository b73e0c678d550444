package ai.bridgegen.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.bridgegen.ast.RawAst;
import ai.bridgegen.convert.ConversionConfig;
import ai.bridgegen.model.QualifiedName;

/**
 * Reads generated bindings and conversion settings from JSON.
 */
public final class BindingsReader {

    private final ObjectMapper mapper;

    public BindingsReader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RawAst.Module readModule(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Bindings file not found: " + file);
        }
        return mapper.readValue(file.toFile(), RawAst.Module.class);
    }

    public RawAst.Module readModule(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        return mapper.readValue(in, RawAst.Module.class);
    }

    public ConfigFile readConfig(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        return mapper.readValue(file.toFile(), ConfigFile.class);
    }

    /**
     * On-disk shape of the config; {@code extraInclude} is not part of {@link ConversionConfig}
     * because it is supplied per conversion.
     */
    public record ConfigFile(
            List<String> includes,
            List<QualifiedName> podRequests,
            boolean oldRust,
            String extraInclude
    ) {
        public ConfigFile {
            includes = includes != null ? List.copyOf(includes) : List.of();
            podRequests = podRequests != null ? List.copyOf(podRequests) : List.of();
        }

        public ConversionConfig toConversionConfig() {
            return new ConversionConfig(includes, podRequests, oldRust);
        }
    }
}
