package com.hotelrates.infrastructure.ota;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelrates.domain.exception.OtaConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide OTA whitelist with enabled/disabled status.
 *
 * <p>Built once at startup from the shared {@code otas.json} file and never mutated, so it is
 * safe for unsynchronized concurrent reads. Membership checks are exact and case-sensitive.
 */
public class OtaRegistry {

    private static final Logger logger = LoggerFactory.getLogger(OtaRegistry.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String WHITELIST_KEY = "WHITELIST_OTAS";

    private final Set<String> whitelist;
    private final Set<String> disabled;

    public OtaRegistry(Collection<String> whitelist, Collection<String> disabled) {
        if (whitelist == null || whitelist.isEmpty()) {
            throw new OtaConfigurationException(WHITELIST_KEY + " must list at least one OTA");
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : whitelist) {
            if (name == null || name.isBlank()) {
                throw new OtaConfigurationException(WHITELIST_KEY + " contains a blank entry");
            }
            if (!name.equals(name.trim())) {
                throw new OtaConfigurationException(WHITELIST_KEY + " entry has surrounding whitespace: '" + name + "'");
            }
            names.add(name);
        }
        this.whitelist = Collections.unmodifiableSet(names);

        Set<String> off = new LinkedHashSet<>();
        if (disabled != null) {
            for (String name : disabled) {
                if (name == null || name.isBlank()) {
                    continue;
                }
                String trimmed = name.trim();
                if (!names.contains(trimmed)) {
                    logger.warn("Disabled OTA '{}' is not whitelisted; ignoring", trimmed);
                    continue;
                }
                off.add(trimmed);
            }
        }
        this.disabled = Collections.unmodifiableSet(off);
    }

    /**
     * Loads the whitelist from a JSON document of the form {@code {"WHITELIST_OTAS": [...]}}.
     *
     * @throws OtaConfigurationException if the resource is missing or malformed
     */
    public static OtaRegistry load(Resource resource, Collection<String> disabled) {
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = OBJECT_MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new OtaConfigurationException("Malformed OTA whitelist " + resource.getDescription(), e);
        } catch (IOException e) {
            throw new OtaConfigurationException("Cannot read OTA whitelist " + resource.getDescription(), e);
        }

        OtaRegistry registry = fromJson(root, disabled);
        logger.info("Loaded {} whitelisted OTAs from {} ({} disabled)",
            registry.whitelist.size(), resource.getDescription(), registry.disabled.size());
        return registry;
    }

    static OtaRegistry fromJson(JsonNode root, Collection<String> disabled) {
        if (root == null || !root.isObject()) {
            throw new OtaConfigurationException("OTA whitelist must be a JSON object");
        }
        JsonNode list = root.get(WHITELIST_KEY);
        if (list == null || !list.isArray()) {
            throw new OtaConfigurationException("OTA whitelist has no " + WHITELIST_KEY + " array");
        }

        List<String> names = new ArrayList<>();
        for (JsonNode entry : list) {
            if (!entry.isTextual()) {
                throw new OtaConfigurationException(WHITELIST_KEY + " entries must be strings, got " + entry);
            }
            names.add(entry.asText());
        }
        return new OtaRegistry(names, disabled);
    }

    public boolean isWhitelisted(String otaName) {
        return otaName != null && whitelist.contains(otaName);
    }

    public boolean isEnabled(String otaName) {
        return isWhitelisted(otaName) && !disabled.contains(otaName);
    }

    /** Whitelisted OTA names in file order. */
    public Set<String> getWhitelist() {
        return whitelist;
    }

    /** Whitelisted OTA names in file order, mapped to their enabled flag. */
    public Map<String, Boolean> getStatuses() {
        Map<String, Boolean> statuses = new LinkedHashMap<>();
        for (String name : whitelist) {
            statuses.put(name, !disabled.contains(name));
        }
        return Collections.unmodifiableMap(statuses);
    }
}
