package ru.petrov.crm_bridge.model;

/**
 * Установленная сессия Salesforce.
 *
 * @param instanceUrl Базовый адрес инстанса (напр. https://acme.my.salesforce.com)
 * @param accessToken Bearer-токен
 */
public record CrmSession(String instanceUrl, String accessToken) {}
