package ru.petrov.crm_bridge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.petrov.crm_bridge.client.CrmApiException;
import ru.petrov.crm_bridge.client.CrmObjectApi;
import ru.petrov.crm_bridge.client.SnapshotStore;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static ru.petrov.crm_bridge.service.FakeCrmApi.field;
import static ru.petrov.crm_bridge.service.FakeCrmApi.record;

class CrmObjectServiceTest {
    private CrmObjectApi api;
    private CrmObjectService service;

    @BeforeEach
    void setUp() {
        api = mock(CrmObjectApi.class);
        when(api.describe("Account")).thenReturn(List.of(field("Id", "id", null), field("Name", "string", null)));
        SchemaCatalog catalog = new SchemaCatalog(api, mock(SnapshotStore.class));
        catalog.load(List.of("Account"), SchemaSource.live());
        service = new CrmObjectService(api, new QueryBuilder(catalog));
    }

    @Test
    void missingRecordIsNotFoundRatherThanError() {
        when(api.execute(anyString())).thenReturn(List.of());

        assertThat(service.getObjectById("Account", "001x0000003DGT2AAC")).isEmpty();
        verify(api).execute("SELECT Id, Name FROM Account WHERE Id = '001x0000003DGT2AAC'");
    }

    @Test
    void firstOfSeveralMatchesWins() {
        when(api.execute(anyString())).thenReturn(List.of(
                record("Id", "001A", "Name", "First"),
                record("Id", "001A", "Name", "Second")));

        assertThat(service.getObjectById("Account", "001A")).hasValueSatisfying(
                found -> assertThat(found).containsEntry("Name", "First"));
    }

    @Test
    void objectWithoutSchemaIsNotQueried() {
        assertThat(service.getObject("Opportunity", null)).isEmpty();
        verify(api, never()).execute(anyString());
    }

    @Test
    void objectWithEmptySchemaIsNotQueried() {
        Map<String, Object> nameless = field("Company", "string", null);
        nameless.remove("name");
        when(api.describe("Lead")).thenReturn(List.of(nameless));
        SchemaCatalog catalog = new SchemaCatalog(api, mock(SnapshotStore.class));
        catalog.load(List.of("Lead"), SchemaSource.live());
        CrmObjectService leads = new CrmObjectService(api, new QueryBuilder(catalog));

        assertThat(leads.getObject("Lead", null)).isEmpty();
        verify(api, never()).execute(anyString());
    }

    @Test
    void getObjectPassesRecordsThrough() {
        List<Map<String, Object>> rows = List.of(record("Id", "001A", "Name", "Acme"));
        when(api.execute("SELECT Id, Name FROM Account WHERE Name = 'Acme'")).thenReturn(rows);

        assertThat(service.getObject("Account", "Name = 'Acme'")).isEqualTo(rows);
    }

    @Test
    void createReturnsIdOrEmpty() {
        when(api.create(eq("Account"), anyMap())).thenReturn("001NEW");
        assertThat(service.createObject("Account", Map.of("Name", "Initech"))).contains("001NEW");

        when(api.create(eq("Contact"), anyMap())).thenThrow(new CrmApiException("REQUIRED_FIELD_MISSING", 400, null));
        assertThat(service.createObject("Contact", Map.of())).isEmpty();
    }
}
