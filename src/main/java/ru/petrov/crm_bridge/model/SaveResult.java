package ru.petrov.crm_bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SaveResult {
    private String id;
    private boolean success;
    private List<Map<String, Object>> errors;
}
