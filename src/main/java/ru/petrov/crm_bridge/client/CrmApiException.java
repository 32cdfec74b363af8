package ru.petrov.crm_bridge.client;

/**
 * Ошибка обращения к REST API Salesforce. Перехватывается в месте использования.
 */
public class CrmApiException extends RuntimeException {
    private final int status;

    public CrmApiException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public CrmApiException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP-статус ответа или 0, если ответа не было.
     */
    public int getStatus() {
        return status;
    }
}
