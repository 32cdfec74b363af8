package ru.petrov.crm_bridge.service;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import ru.petrov.crm_bridge.model.ObjectSchema;

import java.util.Optional;

/**
 * Строит SOQL по схеме из каталога.
 * <p>
 * <b>Внимание:</b> условие WHERE подставляется в запрос как есть, без экранирования.
 * Вызывающий код отвечает за то, чтобы условие было доверенным; не передавайте сюда
 * необработанный пользовательский ввод.
 */
@Component
public class QueryBuilder {
    private final SchemaCatalog catalog;

    public QueryBuilder(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param objectName Имя объекта
     * @param predicate  Условие без слова WHERE (опционально), подставляется дословно
     * @return SELECT по всем полям схемы или пусто, если схема не загружена или в ней нет полей
     */
    public Optional<String> buildSelect(String objectName, String predicate) {
        return catalog.getFields(objectName)
                .filter(schema -> !schema.fields().isEmpty())
                .map(schema -> select(schema, predicate));
    }

    /**
     * Условие поиска по Id. Значение тоже не экранируется.
     */
    public static String idPredicate(String id) {
        return "Id = '" + id + "'";
    }

    private String select(ObjectSchema schema, String predicate) {
        StringBuilder query = new StringBuilder("SELECT ")
                .append(String.join(", ", schema.fieldNames()))
                .append(" FROM ")
                .append(schema.objectName());
        if (StringUtils.hasText(predicate)) {
            query.append(" WHERE ").append(predicate);
        }
        return query.toString();
    }
}
