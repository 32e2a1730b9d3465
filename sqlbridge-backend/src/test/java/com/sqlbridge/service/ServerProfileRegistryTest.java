package com.sqlbridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sqlbridge.model.ProfileCatalog;
import com.sqlbridge.model.ServerProfile;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ServerProfileRegistryTest {

    private final ServerProfileLoader loader = mock(ServerProfileLoader.class);
    private ServerProfileRegistry registry;

    private static ServerProfile profile(String name, boolean readOnly) {
        return ServerProfile.builder().name(name).dbType("sqlserver").host("h").port(1433).readOnly(readOnly).build();
    }

    @BeforeEach
    void setUp() {
        ProfileCatalog catalog = ProfileCatalog.of(
                List.of(profile("SERVER_PROFILE_1", false), profile("SERVER_PROFILE_2", true)), "SERVER_PROFILE_1");
        when(loader.load()).thenReturn(new ServerProfileLoader.LoadResult(catalog, List.of()));
        registry = new ServerProfileRegistry(loader);
        registry.init();
    }

    @Test
    void shouldResolveByNameOrDefault() {
        assertThat(registry.resolve("SERVER_PROFILE_2").isReadOnly()).isTrue();
        assertThat(registry.resolve(null).getName()).isEqualTo("SERVER_PROFILE_1");
        assertThat(registry.resolve("  ").getName()).isEqualTo("SERVER_PROFILE_1");
    }

    @Test
    void shouldResolveSameProfileForSameSnapshot() {
        assertThat(registry.resolve("server_profile_2")).isEqualTo(registry.resolve("SERVER_PROFILE_2"));
    }

    @Test
    void shouldListAvailableProfilesWhenNotFound() {
        assertThatThrownBy(() -> registry.resolve("NOPE"))
                .isInstanceOf(ProfileNotFoundException.class)
                .hasMessageContaining("'NOPE'")
                .hasMessageContaining("SERVER_PROFILE_1, SERVER_PROFILE_2");
    }

    @Test
    void shouldFailResolvingDefaultOnEmptyCatalog() {
        registry.replace(ProfileCatalog.empty());

        assertThat(registry.defaultServerName()).isEmpty();
        assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(ProfileNotFoundException.class);
    }

    @Test
    void shouldSwapCatalogOnReload() {
        ProfileCatalog next = ProfileCatalog.of(List.of(profile("SERVER_PROFILE_3", false)), null);
        when(loader.load()).thenReturn(new ServerProfileLoader.LoadResult(next, List.of("w")));

        ServerProfileLoader.LoadResult result = registry.reload();

        assertThat(result.getWarnings()).containsExactly("w");
        assertThat(registry.list()).extracting(ServerProfile::getName).containsExactly("SERVER_PROFILE_3");
        assertThat(registry.find("SERVER_PROFILE_1")).isEmpty();
        assertThat(registry.defaultServerName()).contains("SERVER_PROFILE_3");
    }
}
