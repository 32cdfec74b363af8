package ru.petrov.crm_bridge.model;

import java.util.List;

/**
 * Прочитанный с диска снимок: имя объекта берется из имени файла.
 */
public record ObjectSnapshot(String objectName, List<FieldDescriptor> fields) {}
