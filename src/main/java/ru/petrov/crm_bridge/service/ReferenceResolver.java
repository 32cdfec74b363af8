package ru.petrov.crm_bridge.service;

import org.springframework.stereotype.Service;
import ru.petrov.crm_bridge.config.SchemaConfig;
import ru.petrov.crm_bridge.model.FieldDescriptor;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Подставляет в запись связанные записи по ее ссылочным полям.
 * <p>
 * Разрешение одноуровневое: ссылки внутри подставленных записей не разрешаются,
 * поэтому циклы в схеме (A -> B -> A) не приводят к бесконечной рекурсии.
 * Чтобы разрешать глубже, понадобятся ограничение глубины и множество посещенных (объект, Id).
 */
@Service
public class ReferenceResolver {
    private static final String ID_SUFFIX = "Id";

    private final SchemaCatalog catalog;
    private final CrmObjectService objectService;
    private final String customSuffix;
    private final String relationshipSuffix;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ReferenceResolver.class);

    public ReferenceResolver(SchemaCatalog catalog, CrmObjectService objectService, SchemaConfig config) {
        this.catalog = catalog;
        this.objectService = objectService;
        this.customSuffix = config.customSuffix();
        this.relationshipSuffix = config.relationshipSuffix();
    }

    /**
     * Разрешает ссылки записи на месте и возвращает ее же.
     *
     * @param record        Изменяемая запись объекта; исходные ключи не меняются, только добавляются новые
     * @param objectName    Имя объекта записи
     * @param allowedFields Какие ссылочные поля разрешать; null — все
     */
    public Map<String, Object> resolve(Map<String, Object> record, String objectName, Collection<String> allowedFields) {
        Map<String, FieldDescriptor> referenceFields = catalog.getReferenceFields(objectName);
        if (referenceFields.isEmpty()) {
            log.debug("У объекта '{}' нет ссылочных полей для разрешения", objectName);
            return record;
        }

        referenceFields.forEach((fieldName, field) -> {
            Object value = record.get(fieldName);
            if (value == null || value.toString().isBlank()) {
                return;
            }
            if (allowedFields != null && !allowedFields.contains(fieldName)) {
                return;
            }
            Optional<Map<String, Object>> target = objectService.getObjectById(field.reference(), value.toString());
            if (target.isPresent()) {
                record.put(relationshipKey(fieldName), target.get());
            } else {
                log.warn("Не удалось разрешить {}.{} = {} (объект {})", objectName, fieldName, value, field.reference());
            }
        });
        return record;
    }

    public Map<String, Object> resolve(Map<String, Object> record, String objectName) {
        return resolve(record, objectName, null);
    }

    /**
     * Ключ, под которым встраивается связанная запись:
     * Parent__c -> Parent__r, OwnerId -> Owner, иначе имя поля с суффиксом связи.
     */
    String relationshipKey(String fieldName) {
        if (fieldName.endsWith(customSuffix)) {
            return fieldName.substring(0, fieldName.length() - customSuffix.length()) + relationshipSuffix;
        }
        if (fieldName.endsWith(ID_SUFFIX) && fieldName.length() > ID_SUFFIX.length()) {
            return fieldName.substring(0, fieldName.length() - ID_SUFFIX.length());
        }
        return fieldName + relationshipSuffix;
    }
}
