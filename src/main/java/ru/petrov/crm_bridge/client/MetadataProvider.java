package ru.petrov.crm_bridge.client;

import java.util.List;
import java.util.Map;

/**
 * Источник метаданных объектов.
 */
public interface MetadataProvider {

    /**
     * Сырые описания полей объекта (элементы fields ответа describe).
     *
     * @throws CrmApiException если описание получить не удалось
     */
    List<Map<String, Object>> describe(String objectName);

    /**
     * Имена всех объектов, доступных в организации; пустой список при ошибке.
     */
    List<String> listObjectNames();
}
