package ru.petrov.crm_bridge.service;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import ru.petrov.crm_bridge.config.SchemaConfig;

/**
 * Загружает каталог при старте, если app.schema.load-on-startup=true.
 * Ошибка установки сессии здесь не перехватывается и останавливает приложение.
 */
@Component
public class SchemaLoadRunner implements ApplicationRunner {
    private final SchemaLoadService loadService;
    private final SchemaConfig config;

    public SchemaLoadRunner(SchemaLoadService loadService, SchemaConfig config) {
        this.loadService = loadService;
        this.config = config;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (config.loadOnStartup()) {
            loadService.reload();
        }
    }
}
