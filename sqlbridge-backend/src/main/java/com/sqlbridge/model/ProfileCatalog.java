package com.sqlbridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of all server profiles plus the resolved default server.
 */
public final class ProfileCatalog {
    private static final ProfileCatalog EMPTY = new ProfileCatalog(Map.of(), null);

    private final Map<String, ServerProfile> profiles;
    private final String defaultServer;

    private ProfileCatalog(Map<String, ServerProfile> profiles, String defaultServer) {
        this.profiles = profiles;
        this.defaultServer = defaultServer;
    }

    public static ProfileCatalog empty() {
        return EMPTY;
    }

    /**
     * Build a catalog. The default is the configured name when it exists in the catalog,
     * otherwise the first profile, otherwise none.
     *
     * @param profiles profiles in catalog order; later duplicates of a name replace earlier ones
     * @param configuredDefault configured default server name, may be null
     */
    public static ProfileCatalog of(List<ServerProfile> profiles, String configuredDefault) {
        Map<String, ServerProfile> byName = new LinkedHashMap<>();
        for (ServerProfile profile : profiles) {
            byName.put(key(profile.getName()), profile);
        }
        String defaultServer = null;
        if (configuredDefault != null && byName.containsKey(key(configuredDefault))) {
            defaultServer = byName.get(key(configuredDefault)).getName();
        } else if (!byName.isEmpty()) {
            defaultServer = byName.values().iterator().next().getName();
        }
        return new ProfileCatalog(Collections.unmodifiableMap(byName), defaultServer);
    }

    public Optional<ServerProfile> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(key(name)));
    }

    public List<ServerProfile> list() {
        return Collections.unmodifiableList(new ArrayList<>(profiles.values()));
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (ServerProfile profile : profiles.values()) {
            names.add(profile.getName());
        }
        return names;
    }

    public Optional<String> getDefaultServer() {
        return Optional.ofNullable(defaultServer);
    }

    public int size() {
        return profiles.size();
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
