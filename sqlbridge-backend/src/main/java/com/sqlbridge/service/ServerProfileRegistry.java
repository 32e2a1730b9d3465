package com.sqlbridge.service;

import com.sqlbridge.model.ProfileCatalog;
import com.sqlbridge.model.ServerProfile;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;

/**
 * Read-mostly catalog of server profiles.
 *
 * <p>Requests read one volatile snapshot; {@link #reload()} builds a complete new catalog and
 * swaps it in a single write, so no request sees a partially updated set.
 */
@Service
public class ServerProfileRegistry {

    private final ServerProfileLoader loader;

    private volatile ProfileCatalog catalog = ProfileCatalog.empty();

    public ServerProfileRegistry(ServerProfileLoader loader) {
        this.loader = loader;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Resolve a profile by name, or the default profile when no name is given.
     *
     * @param name profile name, case-insensitive; null or blank selects the default
     * @return the profile
     * @throws ProfileNotFoundException if nothing matches
     */
    public ServerProfile resolve(String name) {
        ProfileCatalog snapshot = catalog;
        String wanted = name == null || name.isBlank() ? snapshot.getDefaultServer().orElse(null) : name.trim();
        if (wanted == null) {
            throw new ProfileNotFoundException(null, snapshot.names());
        }
        return snapshot.find(wanted)
                .orElseThrow(() -> new ProfileNotFoundException(wanted, snapshot.names()));
    }

    public Optional<ServerProfile> find(String name) {
        return catalog.find(name);
    }

    public List<ServerProfile> list() {
        return catalog.list();
    }

    public Optional<String> defaultServerName() {
        return catalog.getDefaultServer();
    }

    public ProfileCatalog snapshot() {
        return catalog;
    }

    /**
     * Rebuild the catalog from its sources and swap it in.
     *
     * @return load result with the new catalog and any warnings
     */
    public ServerProfileLoader.LoadResult reload() {
        ServerProfileLoader.LoadResult result = loader.load();
        replace(result.getCatalog());
        return result;
    }

    public void replace(ProfileCatalog next) {
        catalog = next != null ? next : ProfileCatalog.empty();
    }
}
