package ru.petrov.crm_bridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Схема одного объекта: имя поля -> описание поля.
 * Порядок обхода совпадает с порядком полей в источнике.
 */
public record ObjectSchema(String objectName, Map<String, FieldDescriptor> fields) {

    public ObjectSchema {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Поля без имени отбрасываются молча, это не ошибка загрузки.
     */
    public static ObjectSchema of(String objectName, List<FieldDescriptor> descriptors) {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        for (FieldDescriptor descriptor : descriptors) {
            if (descriptor != null && descriptor.name() != null) {
                byName.put(descriptor.name(), descriptor);
            }
        }
        return new ObjectSchema(objectName, byName);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public List<FieldDescriptor> descriptors() {
        return new ArrayList<>(fields.values());
    }

    public Map<String, FieldDescriptor> referenceFields() {
        Map<String, FieldDescriptor> references = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            if (field.hasReference()) {
                references.put(name, field);
            }
        });
        return references;
    }
}
