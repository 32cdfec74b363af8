package ru.petrov.crm_bridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;
import ru.petrov.crm_bridge.model.FieldDescriptor;
import ru.petrov.crm_bridge.model.ObjectSnapshot;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Снимки в формате YAML: один файл {@code <Object>.yaml} на объект, список полей.
 */
@Component
public class YamlSnapshotStore implements SnapshotStore {
    static final String EXTENSION = ".yaml";

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(YamlSnapshotStore.class);

    private final ObjectMapper mapper;
    private final CollectionType listType;

    public YamlSnapshotStore() {
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.listType = mapper.getTypeFactory().constructCollectionType(ArrayList.class, FieldDescriptor.class);
    }

    @Override
    public void write(Path location, String objectName, List<FieldDescriptor> fields) throws IOException {
        Files.createDirectories(location);
        Path file = location.resolve(objectName + EXTENSION);
        log.debug("Запись снимка схемы в файл: {}", file);
        mapper.writeValue(file.toFile(), fields);
    }

    @Override
    public List<ObjectSnapshot> listAvailable(Path location) {
        List<ObjectSnapshot> snapshots = new ArrayList<>();
        if (location == null || !Files.isDirectory(location)) {
            log.error("Папка снимков не найдена: {}", location);
            return snapshots;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(location, "*" + EXTENSION)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Не удалось прочитать папку снимков {}: {}", location, e.getMessage());
            return snapshots;
        }
        files.sort(null);

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String objectName = fileName.substring(0, fileName.length() - EXTENSION.length());
            try {
                List<FieldDescriptor> fields = mapper.readValue(file.toFile(), listType);
                if (fields == null) {
                    log.error("Снимок {} пуст, пропускаем", file);
                    continue;
                }
                snapshots.add(new ObjectSnapshot(objectName, fields));
                log.debug("Прочитан снимок {} ({} полей)", objectName, fields.size());
            } catch (IOException e) {
                log.error("Ошибка чтения снимка для {}: {}", objectName, e.getMessage());
            }
        }
        return snapshots;
    }
}
