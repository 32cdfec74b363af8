package ru.petrov.crm_bridge.service;

import org.springframework.stereotype.Service;
import ru.petrov.crm_bridge.client.CrmApiException;
import ru.petrov.crm_bridge.client.CrmObjectApi;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Чтение и создание записей объектов Salesforce по схемам из каталога.
 * Ошибки не пробрасываются: вызывающий код проверяет пустоту результата.
 */
@Service
public class CrmObjectService {
    private final CrmObjectApi crmApi;
    private final QueryBuilder queryBuilder;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CrmObjectService.class);

    public CrmObjectService(CrmObjectApi crmApi, QueryBuilder queryBuilder) {
        this.crmApi = crmApi;
        this.queryBuilder = queryBuilder;
    }

    /**
     * Все записи объекта по условию.
     *
     * @param objectName Имя объекта (напр. Account)
     * @param where      Условие без слова WHERE, опционально; подставляется без экранирования
     */
    public List<Map<String, Object>> getObject(String objectName, String where) {
        Optional<String> query = queryBuilder.buildSelect(objectName, where);
        if (query.isEmpty()) {
            log.error("Поля объекта '{}' не найдены, запрос не выполнен.", objectName);
            return List.of();
        }
        return crmApi.execute(query.get());
    }

    /**
     * Запись по Id. Если совпадений несколько, берется первая в порядке ответа Salesforce.
     */
    public Optional<Map<String, Object>> getObjectById(String objectName, String id) {
        List<Map<String, Object>> results = getObject(objectName, QueryBuilder.idPredicate(id));
        if (results.size() > 1) {
            log.warn("По Id {} объекта {} найдено {} записей, используется первая", id, objectName, results.size());
        }
        return results.stream().findFirst();
    }

    /**
     * Создает запись и возвращает ее Id или пусто при ошибке.
     */
    public Optional<String> createObject(String objectName, Map<String, Object> data) {
        try {
            String id = crmApi.create(objectName, data);
            log.info("Создан {} с Id: {}", objectName, id);
            return Optional.of(id);
        } catch (CrmApiException e) {
            log.error("Ошибка создания {}: {}", objectName, e.getMessage());
            return Optional.empty();
        }
    }
}
