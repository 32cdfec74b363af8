package ru.petrov.crm_bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Нормализованное описание поля объекта Salesforce.
 * В таком же виде (и в том же порядке ключей) поле хранится в YAML-снимке.
 *
 * @param name           Техническое имя поля (напр. AccountId, Parent__c)
 * @param label          Подпись поля, может отсутствовать
 * @param type           Тип поля (string, reference, picklist ...)
 * @param reference      Объект, на который ссылается поле, или null
 * @param length         Длина поля, может отсутствовать
 * @param picklistValues Значения списка выбора в порядке, заданном Salesforce
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "label", "type", "reference", "length", "picklistValues"})
public record FieldDescriptor(
        String name,
        String label,
        String type,
        String reference,
        Integer length,
        List<String> picklistValues
) {

    public FieldDescriptor {
        picklistValues = picklistValues == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(picklistValues));
    }

    /**
     * Строит описание из элемента fields ответа describe.
     * Из referenceTo берется только первая цель, полиморфные ссылки не моделируются.
     */
    public static FieldDescriptor fromDescribe(Map<String, Object> raw) {
        return new FieldDescriptor(
                asString(raw.get("name")),
                asString(raw.get("label")),
                asString(raw.get("type")),
                firstReference(raw.get("referenceTo")),
                asInteger(raw.get("length")),
                picklistValues(raw.get("picklistValues"))
        );
    }

    public boolean hasReference() {
        return reference != null;
    }

    public String displayLabel() {
        return label != null ? label : name;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Нечисловая длина считается отсутствующей.
     */
    private static Integer asInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstReference(Object referenceTo) {
        if (referenceTo instanceof List<?> targets && !targets.isEmpty()) {
            return asString(targets.get(0));
        }
        return null;
    }

    private static List<String> picklistValues(Object entries) {
        List<String> values = new ArrayList<>();
        if (entries instanceof List<?> list) {
            for (Object entry : list) {
                if (entry instanceof Map<?, ?> option) {
                    values.add(asString(option.get("value")));
                }
            }
        }
        return values;
    }
}
