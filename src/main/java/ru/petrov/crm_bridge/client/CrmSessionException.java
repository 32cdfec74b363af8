package ru.petrov.crm_bridge.client;

/**
 * Не удалось установить сессию. Без сессии ничего работать не может, поэтому
 * это исключение не перехватывается и останавливает приложение при старте.
 */
public class CrmSessionException extends RuntimeException {

    public CrmSessionException(String message) {
        super(message);
    }

    public CrmSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
