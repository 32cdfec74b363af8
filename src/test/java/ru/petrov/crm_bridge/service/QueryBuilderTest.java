package ru.petrov.crm_bridge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.petrov.crm_bridge.client.YamlSnapshotStore;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static ru.petrov.crm_bridge.service.FakeCrmApi.field;

class QueryBuilderTest {
    private QueryBuilder queryBuilder;

    @BeforeEach
    void setUp() {
        FakeCrmApi api = new FakeCrmApi()
                .object("Account",
                        field("Id", "id", null),
                        field("Name", "string", null),
                        field("OwnerId", "reference", "User"))
                .object("Lead", nameless());
        SchemaCatalog catalog = new SchemaCatalog(api, new YamlSnapshotStore());
        catalog.load(List.of("Account", "Lead"), SchemaSource.live());
        queryBuilder = new QueryBuilder(catalog);
    }

    @Test
    void selectsAllSchemaFieldsInOrder() {
        assertThat(queryBuilder.buildSelect("Account", null))
                .contains("SELECT Id, Name, OwnerId FROM Account");
    }

    @Test
    void predicateIsAppendedVerbatim() {
        assertThat(queryBuilder.buildSelect("Account", "Name LIKE 'O''Brien%' AND OwnerId != null"))
                .contains("SELECT Id, Name, OwnerId FROM Account WHERE Name LIKE 'O''Brien%' AND OwnerId != null");
    }

    @Test
    void blankPredicateAddsNoWhere() {
        assertThat(queryBuilder.buildSelect("Account", "  "))
                .contains("SELECT Id, Name, OwnerId FROM Account");
    }

    @Test
    void unknownObjectYieldsNoQuery() {
        assertThat(queryBuilder.buildSelect("Opportunity", "Amount > 0")).isEmpty();
    }

    private static Map<String, Object> nameless() {
        Map<String, Object> raw = field("Company", "string", null);
        raw.remove("name");
        return raw;
    }

    @Test
    void schemaWithoutFieldsYieldsNoQuery() {
        assertThat(queryBuilder.buildSelect("Lead", null)).isEmpty();
    }

    @Test
    void idPredicateQuotesTheId() {
        assertThat(QueryBuilder.idPredicate("001x0000003DGT2AAC")).isEqualTo("Id = '001x0000003DGT2AAC'");
    }
}
