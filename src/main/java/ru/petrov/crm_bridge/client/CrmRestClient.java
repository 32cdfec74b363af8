package ru.petrov.crm_bridge.client;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import ru.petrov.crm_bridge.config.CrmConfig;
import ru.petrov.crm_bridge.model.CrmSession;
import ru.petrov.crm_bridge.model.DescribeResponse;
import ru.petrov.crm_bridge.model.GlobalDescribeResponse;
import ru.petrov.crm_bridge.model.QueryResponse;
import ru.petrov.crm_bridge.model.SaveResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * REST-клиент Salesforce поверх WebClient. Все вызовы блокирующие.
 */
@Component
public class CrmRestClient implements CrmObjectApi {
    /** Служебный ключ, который Salesforce добавляет в каждую запись результата. */
    static final String ATTRIBUTES_KEY = "attributes";

    private static final ParameterizedTypeReference<QueryResponse<Map<String, Object>>> QUERY_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final CrmSessionProvider sessions;
    private final String dataPath;

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CrmRestClient.class);

    public CrmRestClient(CrmConfig config, CrmSessionProvider sessions, WebClient.Builder webClientBuilder) {
        this.sessions = sessions;
        this.dataPath = "/services/data/" + config.apiVersion();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(config.maxInMemorySize()))
                .build();
        this.webClient = webClientBuilder.clone()
                .exchangeStrategies(strategies)
                .filter(logRequest())
                .build();
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.info(">>>> ЗАПРОС К SALESFORCE: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    @Override
    public List<Map<String, Object>> describe(String objectName) {
        DescribeResponse response = call("describe " + objectName, session -> webClient.get()
                .uri(session.instanceUrl() + dataPath + "/sobjects/{name}/describe", objectName)
                .headers(headers -> headers.setBearerAuth(session.accessToken()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(DescribeResponse.class)
                .block());
        if (response == null || response.getFields() == null) {
            throw new CrmApiException("Пустой ответ describe для объекта " + objectName, null);
        }
        return response.getFields();
    }

    @Override
    public List<String> listObjectNames() {
        try {
            GlobalDescribeResponse response = call("global describe", session -> webClient.get()
                    .uri(session.instanceUrl() + dataPath + "/sobjects")
                    .headers(headers -> headers.setBearerAuth(session.accessToken()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(GlobalDescribeResponse.class)
                    .block());
            if (response == null || response.getSobjects() == null) {
                return List.of();
            }
            return response.getSobjects().stream()
                    .map(GlobalDescribeResponse.SObjectSummary::getName)
                    .toList();
        } catch (CrmApiException e) {
            log.error("Ошибка получения списка объектов Salesforce: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Аналог query_all: проходит по всем страницам через nextRecordsUrl.
     */
    @Override
    public List<Map<String, Object>> execute(String query) {
        List<Map<String, Object>> records = new ArrayList<>();
        try {
            QueryResponse<Map<String, Object>> page = call("query", session -> webClient.get()
                    .uri(session.instanceUrl() + dataPath + "/query?q={q}", query)
                    .headers(headers -> headers.setBearerAuth(session.accessToken()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(QUERY_PAGE)
                    .block());

            while (page != null) {
                if (page.getRecords() != null) {
                    page.getRecords().forEach(row -> {
                        row.remove(ATTRIBUTES_KEY);
                        records.add(row);
                    });
                }
                String next = page.getNextRecordsUrl();
                if (page.isDone() || next == null) {
                    break;
                }
                page = call("query page", session -> webClient.get()
                        .uri(session.instanceUrl() + next)
                        .headers(headers -> headers.setBearerAuth(session.accessToken()))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(QUERY_PAGE)
                        .block());
            }
        } catch (CrmApiException e) {
            log.error("Ошибка выполнения SOQL-запроса: {}", e.getMessage());
            return List.of();
        }
        log.debug("SOQL-запрос вернул {} записей", records.size());
        return records;
    }

    @Override
    public String create(String objectName, Map<String, Object> data) {
        SaveResult result = call("create " + objectName, session -> webClient.post()
                .uri(session.instanceUrl() + dataPath + "/sobjects/{name}", objectName)
                .headers(headers -> headers.setBearerAuth(session.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(data)
                .retrieve()
                .bodyToMono(SaveResult.class)
                .block());
        if (result == null || !result.isSuccess() || result.getId() == null) {
            throw new CrmApiException("Salesforce отклонил создание " + objectName + ": "
                    + (result != null ? result.getErrors() : "пустой ответ"), null);
        }
        return result.getId();
    }

    /**
     * Выполняет запрос в текущей сессии и переводит ошибки WebClient в {@link CrmApiException}.
     * Ошибка установки сессии не перехватывается.
     */
    private <T> T call(String operation, Function<CrmSession, T> request) {
        CrmSession session = sessions.current();
        try {
            return request.apply(session);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                sessions.invalidate();
            }
            throw new CrmApiException(operation + " завершился ошибкой: " + e.getStatusCode().value()
                    + " " + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new CrmApiException(operation + " завершился ошибкой: " + e.getMessage(), e);
        }
    }
}
