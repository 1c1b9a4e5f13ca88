package com.versemind.models;

import com.versemind.common.config.CatalogSettings;
import com.versemind.common.config.SettingsService;
import com.versemind.models.backend.BackendClient;
import com.versemind.models.backend.HttpBackendClient;
import com.versemind.models.config.ConfigCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the model catalog. One {@link ConfigCache} per
 * application context holds the shared configuration state.
 */
@Slf4j
@Configuration
public class CatalogBeanConfig {

    public static final String SETTINGS_PATH_PROPERTY = "versemind.settings";
    public static final String DEFAULT_SETTINGS_PATH = "~/.versemind/catalog.json";

    @Bean
    public SettingsService settingsService() {
        return new SettingsService(Path.of(System.getProperty(SETTINGS_PATH_PROPERTY, DEFAULT_SETTINGS_PATH)));
    }

    @Bean
    public CatalogSettings catalogSettings(SettingsService settingsService) {
        CatalogSettings settings = settingsService.loadSettings();
        log.info("Model catalog backend: {}", settings.getApiBaseUrl());
        return settings;
    }

    @Bean
    public BackendClient backendClient(CatalogSettings catalogSettings) {
        return new HttpBackendClient(catalogSettings);
    }

    @Bean
    public ConfigCache configCache(BackendClient backendClient, CatalogSettings catalogSettings) {
        return ConfigCache.create(backendClient, catalogSettings);
    }

    @Bean
    public ModelCatalogService modelCatalogService(CatalogSettings catalogSettings,
            ConfigCache configCache, BackendClient backendClient) {
        return new ModelCatalogService(catalogSettings, configCache, backendClient);
    }
}
