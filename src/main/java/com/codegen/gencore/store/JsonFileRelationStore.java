package com.codegen.gencore.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.log4j.Log4j2;

/**
 * {@link RelationStore} that survives process restarts.
 *
 * <p>
 * Each relation lives in {@code <dir>/<relation>.json} as a single JSON object
 * mapping keys to records, in insertion order. Reads are served from memory;
 * every mutation rewrites the relation's file through a temp file and an atomic
 * move while the relation's monitor is held.
 */
@Log4j2
public final class JsonFileRelationStore extends InMemoryRelationStore {
    private static final Pattern RELATION_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileRelationStore(Path directory) {
        this(directory, new ObjectMapper());
    }

    public JsonFileRelationStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreException("Cannot create store directory " + directory, e);
        }
        loadAll();
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void put(String relation, String key, ObjectNode record) {
        checkRelationName(relation);
        super.put(relation, key, record);
    }

    @Override
    protected void onRelationChanged(String relation, Map<String, ObjectNode> records) {
        ObjectNode doc = mapper.createObjectNode();
        records.forEach(doc::set);
        Path target = directory.resolve(relation + SUFFIX);
        Path tmp = directory.resolve(relation + SUFFIX + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to persist relation '{}' to {}", relation, target, e);
            throw new StoreException("Failed to persist relation '" + relation + "'", e);
        }
    }

    private void loadAll() {
        int loaded = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String relation = name.substring(0, name.length() - SUFFIX.length());
                if (!RELATION_NAME.matcher(relation).matches())
                    continue;
                load(relation, readRelation(file));
                loaded++;
            }
        } catch (IOException e) {
            throw new StoreException("Cannot read store directory " + directory, e);
        }
        log.debug("Loaded {} relation(s) from {}", loaded, directory);
    }

    private Map<String, ObjectNode> readRelation(Path file) throws IOException {
        JsonNode doc = mapper.readTree(file.toFile());
        Map<String, ObjectNode> records = new LinkedHashMap<>();
        if (doc == null || !doc.isObject())
            return records;
        var fields = doc.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (field.getValue() instanceof ObjectNode record)
                records.put(field.getKey(), record);
            else
                log.warn("Skipping non-object record '{}' in {}", field.getKey(), file);
        }
        return records;
    }

    private static void checkRelationName(String relation) {
        if (relation == null || !RELATION_NAME.matcher(relation).matches())
            throw new IllegalArgumentException("Relation name not usable as a file name: " + relation);
    }
}
