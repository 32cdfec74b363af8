package ru.petrov.crm_bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Страница результата SOQL-запроса.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResponse<T> {
    private int totalSize;
    private boolean done;
    private String nextRecordsUrl;
    private List<T> records;
}
