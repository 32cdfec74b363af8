package ru.petrov.crm_bridge.client;

import ru.petrov.crm_bridge.model.FieldDescriptor;
import ru.petrov.crm_bridge.model.ObjectSnapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Хранилище снимков схем на диске.
 */
public interface SnapshotStore {

    void write(Path location, String objectName, List<FieldDescriptor> fields) throws IOException;

    /**
     * Все снимки в папке. Снимок, который не удалось прочитать, пропускается.
     */
    List<ObjectSnapshot> listAvailable(Path location);
}
