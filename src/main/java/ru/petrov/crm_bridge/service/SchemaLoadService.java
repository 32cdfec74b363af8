package ru.petrov.crm_bridge.service;

import org.springframework.stereotype.Service;
import ru.petrov.crm_bridge.config.SchemaConfig;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Загрузка каталога схем по настройкам app.schema.
 * Единственная точка записи в каталог: одновременные перезагрузки отклоняются.
 */
@Service
public class SchemaLoadService {
    private final SchemaCatalog catalog;
    private final SchemaConfig config;
    private final AtomicBoolean isLoading = new AtomicBoolean(false);

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SchemaLoadService.class);

    public SchemaLoadService(SchemaCatalog catalog, SchemaConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * @return Количество загруженных схем или -1, если загрузка уже идет в другом потоке
     */
    public int reload() {
        if (!isLoading.compareAndSet(false, true)) {
            log.warn("Загрузка схем уже запущена другим потоком!");
            return -1;
        }

        try {
            SchemaSource source = config.source();
            log.info("Запуск загрузки схем: режим {}, папка {}, объекты {}",
                    source.mode(), source.location(), config.objectNames().isEmpty() ? "все" : config.objectNames());
            return catalog.load(config.objectNames(), source);
        } finally {
            isLoading.set(false);
        }
    }
}
