package ru.petrov.crm_bridge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.petrov.crm_bridge.client.YamlSnapshotStore;
import ru.petrov.crm_bridge.config.SchemaConfig;
import ru.petrov.crm_bridge.model.SchemaSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static ru.petrov.crm_bridge.service.FakeCrmApi.field;
import static ru.petrov.crm_bridge.service.FakeCrmApi.record;

class ReferenceResolverTest {
    private FakeCrmApi api;
    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        // Account и Contact ссылаются друг на друга
        api = new FakeCrmApi()
                .object("Account",
                        field("Id", "id", null),
                        field("Name", "string", null),
                        field("Parent__c", "reference", "Account"),
                        field("OwnerId", "reference", "User"),
                        field("Primary_Contact__c", "reference", "Contact"))
                .object("Contact",
                        field("Id", "id", null),
                        field("LastName", "string", null),
                        field("AccountId", "reference", "Account"))
                .object("User",
                        field("Id", "id", null),
                        field("Username", "string", null))
                .row("Account", record("Id", "001P", "Name", "Parent Corp", "Parent__c", null,
                        "OwnerId", "005U", "Primary_Contact__c", "003C"))
                .row("Account", record("Id", "001A", "Name", "Acme", "Parent__c", "001P",
                        "OwnerId", "005U", "Primary_Contact__c", "003C"))
                .row("Contact", record("Id", "003C", "LastName", "Smith", "AccountId", "001A"))
                .row("User", record("Id", "005U", "Username", "admin@acme.test"));

        SchemaCatalog catalog = new SchemaCatalog(api, new YamlSnapshotStore());
        catalog.load(null, SchemaSource.live());
        SchemaConfig config = new SchemaConfig(List.of(), null, null, false, "__c", "__r");
        resolver = new ReferenceResolver(catalog, new CrmObjectService(api, new QueryBuilder(catalog)), config);
    }

    private Map<String, Object> acme() {
        return record("Id", "001A", "Name", "Acme", "Parent__c", "001P", "OwnerId", "005U", "Primary_Contact__c", "003C");
    }

    @Test
    void customReferenceIsEmbeddedUnderRelationshipKey() {
        Map<String, Object> account = resolver.resolve(acme(), "Account");

        assertThat(account).containsEntry("Parent__c", "001P");
        assertThat(account.get("Parent__r")).isInstanceOfSatisfying(Map.class,
                parent -> assertThat(parent).containsEntry("Name", "Parent Corp"));
    }

    @Test
    void standardReferenceDropsIdSuffix() {
        Map<String, Object> account = resolver.resolve(acme(), "Account");

        assertThat(account).containsEntry("OwnerId", "005U");
        assertThat(account.get("Owner")).isInstanceOfSatisfying(Map.class,
                owner -> assertThat(owner).containsEntry("Username", "admin@acme.test"));
    }

    @Test
    void originalKeysAreKept() {
        Map<String, Object> original = acme();
        Map<String, Object> account = resolver.resolve(new LinkedHashMap<>(original), "Account");

        assertThat(account).containsAllEntriesOf(original);
        assertThat(account.keySet()).containsExactly("Id", "Name", "Parent__c", "OwnerId", "Primary_Contact__c",
                "Parent__r", "Owner", "Primary_Contact__r");
    }

    @Test
    void cycleResolvesExactlyOneLevel() {
        Map<String, Object> contact = resolver.resolve(record("Id", "003C", "LastName", "Smith", "AccountId", "001A"), "Contact");

        @SuppressWarnings("unchecked")
        Map<String, Object> account = (Map<String, Object>) contact.get("Account");
        assertThat(account).containsEntry("Primary_Contact__c", "003C");
        assertThat(account).doesNotContainKeys("Primary_Contact__r", "Parent__r", "Owner");
        assertThat(api.queries).hasSize(1);
    }

    @Test
    void allowListLimitsResolution() {
        Map<String, Object> account = resolver.resolve(acme(), "Account", List.of("Parent__c"));

        assertThat(account).containsKey("Parent__r");
        assertThat(account).doesNotContainKeys("Owner", "Primary_Contact__r");
        assertThat(api.queries).hasSize(1);
    }

    @Test
    void reResolvingAlreadyResolvedFieldChangesNothing() {
        Map<String, Object> account = resolver.resolve(acme(), "Account", List.of("Parent__c"));
        Map<String, Object> before = new LinkedHashMap<>(account);

        resolver.resolve(account, "Account", List.of("Parent__c"));

        assertThat(account).isEqualTo(before);
    }

    @Test
    void missingTargetDoesNotStopSiblings() {
        Map<String, Object> account = acme();
        account.put("Parent__c", "001GONE");

        resolver.resolve(account, "Account");

        assertThat(account).doesNotContainKey("Parent__r");
        assertThat(account).containsKeys("Owner", "Primary_Contact__r");
        assertThat(account).containsEntry("Parent__c", "001GONE");
    }

    @Test
    void emptyReferenceValuesAreNotQueried() {
        Map<String, Object> account = record("Id", "001P", "Name", "Parent Corp", "Parent__c", null,
                "OwnerId", "", "Primary_Contact__c", null);

        resolver.resolve(account, "Account");

        assertThat(api.queries).isEmpty();
        assertThat(account).hasSize(5);
    }

    @Test
    void objectWithoutReferencesIsReturnedAsIs() {
        Map<String, Object> user = record("Id", "005U", "Username", "admin@acme.test");

        assertThat(resolver.resolve(user, "User")).isSameAs(user).hasSize(2);
        assertThat(resolver.resolve(record("Id", "006X"), "Opportunity")).hasSize(1);
        assertThat(api.queries).isEmpty();
    }

    @Test
    void relationshipKeys() {
        assertThat(resolver.relationshipKey("Parent__c")).isEqualTo("Parent__r");
        assertThat(resolver.relationshipKey("OwnerId")).isEqualTo("Owner");
        assertThat(resolver.relationshipKey("Id")).isEqualTo("Id__r");
        assertThat(resolver.relationshipKey("Manager")).isEqualTo("Manager__r");
    }
}
