package ru.petrov.crm_bridge.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.petrov.crm_bridge.model.FieldDescriptor;
import ru.petrov.crm_bridge.service.CrmObjectService;
import ru.petrov.crm_bridge.service.ReferenceResolver;
import ru.petrov.crm_bridge.service.SchemaCatalog;
import ru.petrov.crm_bridge.service.SchemaLoadService;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
public class CrmController {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(CrmController.class);
    private final SchemaCatalog catalog;
    private final SchemaLoadService loadService;
    private final CrmObjectService objectService;
    private final ReferenceResolver referenceResolver;


    public CrmController(SchemaCatalog catalog, SchemaLoadService loadService,
                         CrmObjectService objectService, ReferenceResolver referenceResolver) {
        this.catalog = catalog;
        this.loadService = loadService;
        this.objectService = objectService;
        this.referenceResolver = referenceResolver;
    }

    @GetMapping(value = "/api/schema", produces = MediaType.APPLICATION_JSON_VALUE)
    public Set<String> loadedObjects() {
        return catalog.loadedObjectNames();
    }

    /**
     * Поля объекта, отсортированные по подписи (при отсутствии подписи — по имени).
     */
    @GetMapping(value = "/api/schema/{objectName}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<FieldDescriptor>> objectFields(@PathVariable String objectName) {
        return catalog.getFields(objectName)
                .map(schema -> schema.descriptors().stream()
                        .sorted(Comparator.comparing(FieldDescriptor::displayLabel))
                        .toList())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/api/admin/schema/reload")
    public ResponseEntity<String> reloadSchema() {
        log.info("Запущена ручная перезагрузка схем объектов");
        int loaded = loadService.reload();
        if (loaded < 0) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Загрузка схем уже выполняется.");
        }
        return ResponseEntity.ok("Загружено схем: " + loaded + ". Проверьте логи для деталей.");
    }

    /**
     * @param where Условие SOQL без слова WHERE. Подставляется в запрос без экранирования,
     *              поэтому этот эндпоинт предназначен только для доверенных клиентов.
     */
    @GetMapping(value = "/api/objects/{objectName}", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, Object>> objects(@PathVariable String objectName,
                                             @RequestParam(required = false) String where) {
        log.info("Запрос записей {} с условием: {}", objectName, where);
        return objectService.getObject(objectName, where);
    }

    /**
     * @param id   Id записи. Как и where, подставляется в условие Id = '...' без экранирования,
     *             эндпоинт только для доверенных клиентов.
     * @param refs Какие ссылочные поля разрешать при resolve=true; по умолчанию все
     */
    @GetMapping(value = "/api/objects/{objectName}/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> objectById(@PathVariable String objectName,
                                                          @PathVariable String id,
                                                          @RequestParam(defaultValue = "false") boolean resolve,
                                                          @RequestParam(required = false) List<String> refs) {
        return objectService.getObjectById(objectName, id)
                .map(record -> resolve ? referenceResolver.resolve(record, objectName, refs) : record)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/api/objects/{objectName}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> createObject(@PathVariable String objectName,
                                               @RequestBody Map<String, Object> data) {
        return objectService.createObject(objectName, data)
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(id))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.BAD_GATEWAY).body("Salesforce не создал запись " + objectName));
    }
}
