package ru.petrov.crm_bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.nio.file.Path;
import java.util.List;

/**
 * Настройки загрузки каталога схем.
 * Если задан cacheFolder, схемы читаются из снимков, иначе запрашиваются у Salesforce
 * (и при заданном outputFolder сохраняются в снимки).
 */
@ConfigurationProperties(prefix = "app.schema")
public record SchemaConfig(
        List<String> objects,
        String cacheFolder,
        String outputFolder,
        @DefaultValue("false") boolean loadOnStartup,
        @DefaultValue("__c") String customSuffix,
        @DefaultValue("__r") String relationshipSuffix
) {

    public List<String> objectNames() {
        return objects == null ? List.of() : objects;
    }

    public SchemaSource source() {
        if (StringUtils.hasText(cacheFolder)) {
            return SchemaSource.snapshot(Path.of(cacheFolder));
        }
        return StringUtils.hasText(outputFolder)
                ? SchemaSource.live(Path.of(outputFolder))
                : SchemaSource.live();
    }
}
