package com.datacron.admin.core.store;

import com.datacron.admin.core.model.TenantConfig;
import com.datacron.core.util.GsonTool;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h1>The JSON configuration file</h1>
 *
 * Layout: {@code {"<tenant>": {"cron": [job...], "data": {"<key>": value}}}}.
 */
@Slf4j
public class ConfigFileStore {

    private static final Type CONFIG_TYPE = new TypeToken<LinkedHashMap<String, TenantConfig>>() {
    }.getType();

    @Getter
    private final Path path;

    public ConfigFileStore(Path path) {
        this.path = path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * @return the tenants of the file in file order, empty for an empty file
     * @throws IOException when the file cannot be read or is not a valid configuration
     */
    public Map<String, TenantConfig> load() throws IOException {
        String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        if (json.trim().isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, TenantConfig> config = GsonTool.fromJson(json, CONFIG_TYPE);
            return config != null ? config : new LinkedHashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the whole configuration. The parent directory is created on demand and the
     * file is replaced in one move, so a crash never leaves half a file behind.
     */
    public void save(Map<String, TenantConfig> config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(temp, GsonTool.toPrettyJson(config).getBytes(StandardCharsets.UTF_8));
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug(">>>>>>>>>>> datacron, configuration written to {}", path);
    }
}
