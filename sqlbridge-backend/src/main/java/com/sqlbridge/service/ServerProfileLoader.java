package com.sqlbridge.service;

import com.sqlbridge.config.GatewayProperties;
import com.sqlbridge.model.ProfileCatalog;
import com.sqlbridge.model.ProfilesFile;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.util.DbTypeNormalizer;
import com.sqlbridge.util.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the server profile catalog from its three sources, in override order:
 * <ol>
 *   <li>{@code sqlbridge.servers.*} application properties</li>
 *   <li>{@code DATABASE_PROFILES_<NAME>_<SUFFIX>} environment-style keys</li>
 *   <li>the optional YAML file named by {@code sqlbridge.profiles-file}</li>
 * </ol>
 */
@Component
public class ServerProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(ServerProfileLoader.class);

    static final String ENV_PREFIX = "DATABASE_PROFILES_";

    // Order matters: the first suffix a key ends with decides the profile name.
    private static final List<String> ENV_SUFFIXES = List.of(
            "_DRIVER", "_DB_TYPE", "_SERVER", "_PORT", "_USERNAME", "_PASSWORD",
            "_DATABASE_NAME", "_TRUSTED_CONNECTION", "_ENCRYPT", "_READ_ONLY", "_JDBC_URL"
    );

    private static final String ENV_DEFAULT_DRIVER = "ODBC Driver 17 for SQL Server";
    private static final int ENV_DEFAULT_PORT = 1433;
    private static final String ENV_DEFAULT_USERNAME = "sa";
    private static final String ENV_DEFAULT_DATABASE = "master";

    private final GatewayProperties properties;
    private final Environment environment;

    public ServerProfileLoader(GatewayProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * Result of loading the catalog. Problems with single profiles are reported as warnings;
     * they never fail the whole load.
     */
    public static class LoadResult {
        private final ProfileCatalog catalog;
        private final List<String> warnings;

        public LoadResult(ProfileCatalog catalog, List<String> warnings) {
            this.catalog = catalog;
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public ProfileCatalog getCatalog() {
            return catalog;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }

    public LoadResult load() {
        List<String> warnings = new ArrayList<>();
        Map<String, ServerProfile> profiles = new LinkedHashMap<>();
        String defaultServer = trimToNull(properties.getDefaultServer());

        Map<String, GatewayProperties.ServerProperties> configured = properties.getServers();
        if (configured != null) {
            configured.forEach((name, props) -> addProfile(profiles, name, props, "application properties", warnings));
        }

        loadFromEnvironment(profiles, warnings);

        String file = trimToNull(properties.getProfilesFile());
        if (file != null) {
            ProfilesFile parsed = loadProfilesFile(Paths.get(file), warnings);
            if (parsed != null) {
                if (parsed.getServers() != null) {
                    parsed.getServers().forEach((name, props) -> addProfile(profiles, name, props, file, warnings));
                }
                if (trimToNull(parsed.getDefaultServer()) != null) {
                    defaultServer = parsed.getDefaultServer().trim();
                }
            }
        }

        ProfileCatalog catalog = ProfileCatalog.of(new ArrayList<>(profiles.values()), defaultServer);
        if (defaultServer != null && catalog.size() > 0 && catalog.find(defaultServer).isEmpty()) {
            warnings.add("Default server '" + defaultServer + "' is not configured; using "
                    + catalog.getDefaultServer().orElse(null));
        }

        log.info("Loaded {} server profile(s): {} (default: {})",
                catalog.size(), catalog.names().isEmpty() ? "(none)" : String.join(", ", catalog.names()),
                catalog.getDefaultServer().orElse(null));
        for (String w : warnings) {
            log.warn("Server profile warning: {}", w);
        }
        return new LoadResult(catalog, warnings);
    }

    private void addProfile(Map<String, ServerProfile> profiles,
                            String rawName,
                            GatewayProperties.ServerProperties props,
                            String source,
                            List<String> warnings) {
        String name = trimToNull(rawName);
        if (name == null || props == null) {
            warnings.add("Skipping unnamed or empty profile from " + source);
            return;
        }
        name = name.toUpperCase(Locale.ROOT);

        String dbType = DbTypeNormalizer.normalize(props.getDbType());
        SqlDialect dialect = SqlDialect.of(dbType);
        boolean hasUrl = trimToNull(props.getJdbcUrl()) != null;
        if (!hasUrl && trimToNull(props.getHost()) == null && dialect != SqlDialect.H2) {
            warnings.add("Skipping profile " + name + " from " + source + ": missing host");
            return;
        }

        ServerProfile profile = ServerProfile.builder()
                .name(name)
                .dbType(dbType.isEmpty() ? dialect.getDbType() : dbType)
                .host(trimToNull(props.getHost()))
                .port(props.getPort() != null && props.getPort() > 0 ? props.getPort() : dialect.getDefaultPort())
                .username(props.getUsername())
                .password(props.getPassword())
                .defaultDatabase(trimToNull(props.getDatabase()))
                .readOnly(props.isReadOnly())
                .encrypt(props.isEncrypt())
                .trustServerCertificate(props.isTrustServerCertificate())
                .jdbcUrl(trimToNull(props.getJdbcUrl()))
                .maxPoolSize(Math.max(1, props.getMaxPoolSize()))
                .minIdle(Math.max(0, Math.min(props.getMinIdle(), props.getMaxPoolSize())))
                .build();

        if (profiles.containsKey(name)) {
            log.info("Server profile {} from {} overrides an earlier definition", name, source);
        }
        profiles.put(name, profile);
    }

    private void loadFromEnvironment(Map<String, ServerProfile> profiles, List<String> warnings) {
        Set<String> names = new LinkedHashSet<>();
        for (String key : environmentKeys()) {
            if (!key.startsWith(ENV_PREFIX)) {
                continue;
            }
            String afterPrefix = key.substring(ENV_PREFIX.length());
            for (String suffix : ENV_SUFFIXES) {
                if (afterPrefix.endsWith(suffix)) {
                    String name = afterPrefix.substring(0, afterPrefix.length() - suffix.length());
                    if (!name.isEmpty()) {
                        names.add(name);
                    }
                    break;
                }
            }
        }

        for (String name : names) {
            String prefix = ENV_PREFIX + name + "_";
            GatewayProperties.ServerProperties props = new GatewayProperties.ServerProperties();
            String dbType = env(prefix + "DB_TYPE");
            props.setDbType(dbType != null ? dbType : envOrDefault(prefix + "DRIVER", ENV_DEFAULT_DRIVER));
            props.setHost(env(prefix + "SERVER"));
            props.setPort(parsePort(env(prefix + "PORT"), name, warnings));
            props.setUsername(envOrDefault(prefix + "USERNAME", ENV_DEFAULT_USERNAME));
            props.setPassword(envOrDefault(prefix + "PASSWORD", ""));
            props.setDatabase(envOrDefault(prefix + "DATABASE_NAME", ENV_DEFAULT_DATABASE));
            props.setReadOnly("true".equalsIgnoreCase(env(prefix + "READ_ONLY")));
            props.setEncrypt("true".equalsIgnoreCase(env(prefix + "ENCRYPT")));
            // A trusted (integrated) connection validates the server certificate.
            props.setTrustServerCertificate(!"true".equalsIgnoreCase(env(prefix + "TRUSTED_CONNECTION")));
            props.setJdbcUrl(env(prefix + "JDBC_URL"));

            if (props.getHost() == null && props.getJdbcUrl() == null) {
                warnings.add("Skipping profile " + name + " from environment: missing " + prefix + "SERVER");
                continue;
            }
            addProfile(profiles, name, props, "environment", warnings);
        }
    }

    private Set<String> environmentKeys() {
        Set<String> keys = new LinkedHashSet<>();
        if (environment instanceof ConfigurableEnvironment configurable) {
            for (PropertySource<?> source : configurable.getPropertySources()) {
                if (source instanceof EnumerablePropertySource<?> enumerable) {
                    Collections.addAll(keys, enumerable.getPropertyNames());
                }
            }
        }
        return keys;
    }

    private ProfilesFile loadProfilesFile(Path path, List<String> warnings) {
        if (!Files.isRegularFile(path)) {
            warnings.add("Profiles file does not exist or is not a file: " + path);
            return null;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProfilesFile parsed = new Yaml().loadAs(reader, ProfilesFile.class);
            return parsed != null ? parsed : new ProfilesFile();
        } catch (Exception e) {
            log.error("Failed to read profiles file {}", path, e);
            warnings.add("Failed to read profiles file " + path + ": " + e.getMessage());
            return null;
        }
    }

    private Integer parsePort(String raw, String name, List<String> warnings) {
        if (raw == null) {
            return ENV_DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            warnings.add("Invalid port '" + raw + "' for profile " + name + "; using " + ENV_DEFAULT_PORT);
            return ENV_DEFAULT_PORT;
        }
    }

    private String env(String key) {
        return trimToNull(environment.getProperty(key));
    }

    private String envOrDefault(String key, String defaultValue) {
        String v = env(key);
        return v != null ? v : defaultValue;
    }

    private static String trimToNull(String v) {
        if (v == null) {
            return null;
        }
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
