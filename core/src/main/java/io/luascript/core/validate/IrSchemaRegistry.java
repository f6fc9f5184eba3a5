package io.luascript.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Archived IR JSON Schemas on the classpath under {@code schemas/ir/ir-<version>.schema.json}.
 *
 * <p>Archived files are never edited. A new node kind or optional field is a MINOR bump with a new
 * file; removing or retyping anything is a MAJOR bump.
 */
public final class IrSchemaRegistry {

    /** Every archived schema version, oldest first. */
    public static final List<String> ARCHIVED_VERSIONS = List.of("1.0.0");

    /** MAJOR line this toolchain reads and writes. */
    public static final int CURRENT_MAJOR = 1;

    private static final String RESOURCE_PATTERN = "/schemas/ir/ir-%s.schema.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    /** Whether {@code version} has an archived schema. */
    public boolean isKnown(String version) {
        return version != null && ARCHIVED_VERSIONS.contains(version);
    }

    /** The newest archived version in the current MAJOR line. */
    public static String latest() {
        return ARCHIVED_VERSIONS.stream()
                .filter(v -> major(v) == CURRENT_MAJOR)
                .max(Comparator.comparing(IrSchemaRegistry::versionKey, Arrays::compare))
                .orElseThrow(() -> new IllegalStateException("No archived schema for major " + CURRENT_MAJOR));
    }

    /** The compiled schema for {@code version}, or empty when it is not archived. */
    public Optional<JsonSchema> schema(String version) {
        if (!isKnown(version)) {
            return Optional.empty();
        }
        return Optional.of(compiled.computeIfAbsent(version, v -> SCHEMA_FACTORY.getSchema(load(v))));
    }

    /**
     * The raw schema document for {@code version}.
     *
     * @throws IllegalArgumentException if the version is not archived
     */
    public JsonNode schemaDocument(String version) {
        if (!isKnown(version)) {
            throw new IllegalArgumentException("Unknown IR schema version: " + version);
        }
        return load(version);
    }

    private static JsonNode load(String version) {
        String resource = String.format(RESOURCE_PATTERN, version);
        try (InputStream in = IrSchemaRegistry.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("IR schema resource missing from classpath: " + resource);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read IR schema " + resource, e);
        }
    }

    static int major(String version) {
        return versionKey(version)[0];
    }

    private static int[] versionKey(String version) {
        String[] parts = version.split("\\.");
        int[] key = new int[3];
        for (int i = 0; i < key.length && i < parts.length; i++) {
            key[i] = Integer.parseInt(parts[i]);
        }
        return key;
    }
}
