package ru.petrov.crm_bridge.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Параметры подключения к Salesforce (OAuth2 client credentials).
 *
 * @param tokenUrl        Адрес выдачи токена (SALESFORCE_TOKEN_URL)
 * @param consumerKey     Client id подключенного приложения
 * @param consumerSecret  Client secret подключенного приложения
 * @param apiVersion      Версия REST API, например v59.0
 * @param maxInMemorySize Лимит буфера ответа WebClient в байтах
 */
@Validated
@ConfigurationProperties(prefix = "app.crm")
public record CrmConfig(
        @NotBlank(message = "URL получения токена обязателен")
        String tokenUrl,

        @NotBlank(message = "Consumer key обязателен")
        String consumerKey,

        @NotBlank(message = "Consumer secret обязателен")
        String consumerSecret,

        @DefaultValue("v59.0") String apiVersion,
        @DefaultValue("52428800") int maxInMemorySize
) {}
