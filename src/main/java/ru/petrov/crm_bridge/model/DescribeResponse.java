package ru.petrov.crm_bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Ответ sobjects/{name}/describe. Поля оставлены "сырыми", нормализация — в {@link FieldDescriptor}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DescribeResponse {
    private List<Map<String, Object>> fields;
}
