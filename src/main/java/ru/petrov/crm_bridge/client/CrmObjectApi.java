package ru.petrov.crm_bridge.client;

import java.util.Map;

/**
 * Обобщенный доступ к объектам Salesforce: имя объекта передается явно параметром.
 */
public interface CrmObjectApi extends MetadataProvider, QueryExecutor {

    /**
     * Создает запись и возвращает ее Id.
     *
     * @throws CrmApiException если Salesforce отклонил запись или запрос не прошел
     */
    String create(String objectName, Map<String, Object> data);
}
