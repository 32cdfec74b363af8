package ru.petrov.crm_bridge.client;

import java.util.List;
import java.util.Map;

/**
 * Выполнение SOQL. Возвращает все записи в порядке источника (пагинация — забота реализации),
 * при ошибке — пустой список.
 */
public interface QueryExecutor {

    List<Map<String, Object>> execute(String query);
}
