package com.codegen.gencore.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Runtime settings of the generation core.
 *
 * <p>
 * Resolution order, later wins:
 * <ol>
 * <li>classpath {@code gencore.json}</li>
 * <li>an optional JSON file passed to {@link #load(Path)}</li>
 * <li>{@code -Dgencore.<field>} system properties</li>
 * </ol>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CoreConfig {
    public static final String DEFAULTS_RESOURCE = "gencore.json";
    public static final String PROPERTY_PREFIX = "gencore.";

    public static final String STORAGE_MEMORY = "memory";
    public static final String STORAGE_FILE = "file";

    /** {@code memory} or {@code file}. */
    private String storage = STORAGE_MEMORY;
    /** Directory of the file store. */
    private String storageDir = ".gencore";
    private int historyLimit = 10;
    /** Must be a power of two. */
    private int ringBufferSize = 1024;
    /** 0 disables the diagnostics server. */
    private int diagnosticsPort = 0;
    /** Taxonomy applied at startup: {@code classpath:<resource>}, a file path, or empty. */
    private String taxonomy = "";

    public static CoreConfig load() {
        return load(null);
    }

    public static CoreConfig load(Path overrides) {
        ObjectMapper mapper = new ObjectMapper();
        CoreConfig config = new CoreConfig();
        try (InputStream in = CoreConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null)
                mapper.readerForUpdating(config).readValue(in);
            if (overrides != null)
                mapper.readerForUpdating(config).readValue(Files.readAllBytes(overrides));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load gencore configuration", e);
        }
        config.applyProperties(System.getProperties());
        config.validate();
        return config;
    }

    /** Applies {@code gencore.*} entries from {@code props}. */
    public CoreConfig applyProperties(Properties props) {
        String v;
        if ((v = props.getProperty(PROPERTY_PREFIX + "storage")) != null)
            storage = v.trim();
        if ((v = props.getProperty(PROPERTY_PREFIX + "storageDir")) != null)
            storageDir = v.trim();
        if ((v = props.getProperty(PROPERTY_PREFIX + "historyLimit")) != null)
            historyLimit = parseInt("historyLimit", v);
        if ((v = props.getProperty(PROPERTY_PREFIX + "ringBufferSize")) != null)
            ringBufferSize = parseInt("ringBufferSize", v);
        if ((v = props.getProperty(PROPERTY_PREFIX + "diagnosticsPort")) != null)
            diagnosticsPort = parseInt("diagnosticsPort", v);
        if ((v = props.getProperty(PROPERTY_PREFIX + "taxonomy")) != null)
            taxonomy = v.trim();
        return this;
    }

    public void validate() {
        if (!STORAGE_MEMORY.equals(storage) && !STORAGE_FILE.equals(storage))
            throw new IllegalArgumentException("Unknown storage '" + storage + "', expected memory or file");
        if (STORAGE_FILE.equals(storage) && (storageDir == null || storageDir.isBlank()))
            throw new IllegalArgumentException("storageDir is required for file storage");
        if (historyLimit <= 0)
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        if (diagnosticsPort < 0 || diagnosticsPort > 65535)
            throw new IllegalArgumentException("diagnosticsPort out of range: " + diagnosticsPort);
    }

    private static int parseInt(String field, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PROPERTY_PREFIX + field + ": " + value, e);
        }
    }
}
