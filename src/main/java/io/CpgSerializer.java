package io;

import assembly.EnhancedModuleData;
import ast.SourcePositionId;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import errors.CpgIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lossless JSON encoding of module records. Field names are written in snake_case and every id
 * and enum value is kept, so reading a written record gives back an equal one.
 */
public class CpgSerializer {
    private static final Logger logger = LoggerFactory.getLogger(CpgSerializer.class);

    private final Gson gson;

    public CpgSerializer() {
        this(true);
    }

    public CpgSerializer(boolean pretty) {
        GsonBuilder builder = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .registerTypeAdapter(SourcePositionId.class, new SourcePositionIdAdapter())
                .serializeNulls()
                .disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String toJson(Object value) {
        return gson.toJson(value);
    }

    public <T> T fromJson(String json, Class<T> type) {
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new CpgIoException("Malformed " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    public EnhancedModuleData fromJson(String json) {
        return fromJson(json, EnhancedModuleData.class);
    }

    public void write(EnhancedModuleData module, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                gson.toJson(module, writer);
            }
        } catch (IOException e) {
            throw new CpgIoException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        logger.info("Module {} written to {}", module.getModuleName(), path);
    }

    public EnhancedModuleData read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, EnhancedModuleData.class);
        } catch (IOException e) {
            throw new CpgIoException("Failed to read " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new CpgIoException("Malformed module JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    // Written as "sp<n>", the same text used when an id is a map key.
    private static final class SourcePositionIdAdapter extends TypeAdapter<SourcePositionId> {
        @Override
        public void write(JsonWriter out, SourcePositionId value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public SourcePositionId read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            String text = in.nextString();
            if (!text.startsWith("sp")) {
                throw new JsonParseException("Not a source position id: " + text);
            }
            try {
                return new SourcePositionId(Long.parseLong(text.substring(2)));
            } catch (NumberFormatException e) {
                throw new JsonParseException("Not a source position id: " + text, e);
            }
        }
    }
}
