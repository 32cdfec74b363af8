package ru.petrov.crm_bridge.model;

import java.nio.file.Path;

/**
 * Откуда загружать каталог схем.
 *
 * @param mode     LIVE — describe через API, SNAPSHOT — YAML-снимки
 * @param location Для LIVE — папка для записи снимков (может быть null), для SNAPSHOT — папка со снимками
 */
public record SchemaSource(Mode mode, Path location) {

    public enum Mode {LIVE, SNAPSHOT}

    public static SchemaSource live() {
        return new SchemaSource(Mode.LIVE, null);
    }

    public static SchemaSource live(Path output) {
        return new SchemaSource(Mode.LIVE, output);
    }

    public static SchemaSource snapshot(Path folder) {
        return new SchemaSource(Mode.SNAPSHOT, folder);
    }
}
