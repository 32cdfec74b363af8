package ru.petrov.crm_bridge.client;

import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import ru.petrov.crm_bridge.config.CrmConfig;
import ru.petrov.crm_bridge.model.CrmSession;
import ru.petrov.crm_bridge.model.TokenResponse;

/**
 * Получает и хранит сессию Salesforce (OAuth2 client credentials).
 * Сессия устанавливается при первом обращении и переиспользуется.
 */
@Component
public class CrmSessionProvider {
    private final CrmConfig config;
    private final WebClient webClient;
    private CrmSession session;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CrmSessionProvider.class);

    public CrmSessionProvider(CrmConfig config, WebClient.Builder webClientBuilder) {
        this.config = config;
        this.webClient = webClientBuilder.clone().build();
    }

    public synchronized CrmSession current() {
        if (session == null) {
            session = authenticate();
        }
        return session;
    }

    /**
     * Сбрасывает сессию, например после ответа 401; следующий вызов {@link #current()} авторизуется заново.
     */
    public synchronized void invalidate() {
        session = null;
    }

    private CrmSession authenticate() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", config.consumerKey());
        form.add("client_secret", config.consumerSecret());

        TokenResponse token;
        try {
            token = webClient.post()
                    .uri(config.tokenUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(TokenResponse.class)
                    .block();
        } catch (RuntimeException e) {
            log.error("Ошибка подключения к Salesforce: {}", e.getMessage());
            throw new CrmSessionException("Не удалось получить токен по адресу " + config.tokenUrl(), e);
        }

        if (token == null || !StringUtils.hasText(token.instanceUrl()) || !StringUtils.hasText(token.accessToken())) {
            log.error("Ответ сервера авторизации не содержит instance_url/access_token");
            throw new CrmSessionException("В ответе сервера авторизации нет instance_url или access_token");
        }
        log.info("Подключение к Salesforce установлено: {}", token.instanceUrl());
        return new CrmSession(token.instanceUrl(), token.accessToken());
    }
}
