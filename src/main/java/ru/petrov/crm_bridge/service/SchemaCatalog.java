package ru.petrov.crm_bridge.service;

import org.springframework.stereotype.Service;
import ru.petrov.crm_bridge.client.CrmApiException;
import ru.petrov.crm_bridge.client.MetadataProvider;
import ru.petrov.crm_bridge.client.SnapshotStore;
import ru.petrov.crm_bridge.model.FieldDescriptor;
import ru.petrov.crm_bridge.model.ObjectSchema;
import ru.petrov.crm_bridge.model.ObjectSnapshot;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Каталог схем объектов Salesforce на все время жизни процесса.
 * <p>
 * Заполняется через {@link #load}, после чего только читается. Каждая загрузка собирает
 * новую карту и публикует ее целиком, так что читатели видят либо старый, либо новый каталог.
 * Блокировок нет: сами загрузки должны упорядочиваться вызывающей стороной
 * (см. {@link SchemaLoadService}).
 */
@Service
public class SchemaCatalog {
    private final MetadataProvider metadataProvider;
    private final SnapshotStore snapshotStore;
    private volatile Map<String, ObjectSchema> schemas = Map.of();

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SchemaCatalog.class);

    public SchemaCatalog(MetadataProvider metadataProvider, SnapshotStore snapshotStore) {
        this.metadataProvider = metadataProvider;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Загружает схемы объектов в каталог. Уже загруженные схемы с теми же именами заменяются.
     *
     * @param names  Имена объектов; пусто или null — все объекты (в режиме снимков — все снимки)
     * @param source Источник: describe через API или YAML-снимки
     * @return Количество загруженных схем
     */
    public int load(Collection<String> names, SchemaSource source) {
        boolean filtered = names != null && !names.isEmpty();
        Map<String, ObjectSchema> next = new LinkedHashMap<>(schemas);
        int loaded = source.mode() == SchemaSource.Mode.SNAPSHOT
                ? loadSnapshots(next, filtered ? Set.copyOf(names) : null, source.location())
                : loadLive(next, filtered ? new ArrayList<>(names) : metadataProvider.listObjectNames(), source.location());
        schemas = Collections.unmodifiableMap(next);
        log.info("Загрузка схем ({}) завершена. Загружено объектов: {}, всего в каталоге: {}",
                source.mode(), loaded, schemas.size());
        return loaded;
    }

    private int loadLive(Map<String, ObjectSchema> target, List<String> objectNames, Path output) {
        int loaded = 0;
        for (String objectName : objectNames) {
            List<Map<String, Object>> rawFields;
            try {
                rawFields = metadataProvider.describe(objectName);
            } catch (CrmApiException e) {
                log.error("Объект '{}' не найден или describe завершился ошибкой (HTTP {}): {}",
                        objectName, e.getStatus(), e.getMessage());
                continue;
            }

            ObjectSchema schema;
            try {
                schema = ObjectSchema.of(objectName, rawFields.stream()
                        .map(FieldDescriptor::fromDescribe)
                        .toList());
            } catch (RuntimeException e) {
                log.error("Не удалось разобрать описание полей объекта '{}': {}", objectName, e.getMessage());
                continue;
            }
            target.put(objectName, schema);
            loaded++;
            log.debug("Загружена схема {}: {} полей", objectName, schema.fields().size());

            if (output != null) {
                try {
                    snapshotStore.write(output, objectName, schema.descriptors());
                } catch (IOException e) {
                    log.error("Не удалось записать снимок схемы {} в {}: {}", objectName, output, e.getMessage());
                }
            }
        }
        return loaded;
    }

    private int loadSnapshots(Map<String, ObjectSchema> target, Set<String> filter, Path folder) {
        int loaded = 0;
        for (ObjectSnapshot snapshot : snapshotStore.listAvailable(folder)) {
            if (filter != null && !filter.contains(snapshot.objectName())) {
                continue;
            }
            ObjectSchema schema = ObjectSchema.of(snapshot.objectName(), snapshot.fields());
            target.put(snapshot.objectName(), schema);
            loaded++;
            log.debug("Загружена схема {} из снимка: {} полей", snapshot.objectName(), schema.fields().size());
        }
        return loaded;
    }

    /**
     * Схема объекта. Пусто, если каталог еще не загружен или объект не загружался.
     */
    public Optional<ObjectSchema> getFields(String objectName) {
        Map<String, ObjectSchema> current = schemas;
        if (current.isEmpty()) {
            log.error("Каталог схем не загружен. Сначала вызовите load().");
            return Optional.empty();
        }
        ObjectSchema schema = current.get(objectName);
        if (schema == null) {
            log.error("Объект '{}' отсутствует в загруженных схемах.", objectName);
        }
        return Optional.ofNullable(schema);
    }

    /**
     * Ссылочные поля объекта в порядке схемы; пусто, если схемы нет или ссылок нет.
     */
    public Map<String, FieldDescriptor> getReferenceFields(String objectName) {
        return getFields(objectName)
                .map(ObjectSchema::referenceFields)
                .orElse(Map.of());
    }

    public Set<String> loadedObjectNames() {
        return new TreeSet<>(schemas.keySet());
    }
}
