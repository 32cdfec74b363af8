package ru.petrov.crm_bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalDescribeResponse {
    private List<SObjectSummary> sobjects;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SObjectSummary {
        private String name;
    }
}
