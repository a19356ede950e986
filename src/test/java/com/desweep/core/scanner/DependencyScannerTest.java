package com.desweep.core.scanner;

import com.desweep.core.loader.BulkDataset;
import com.desweep.core.metrics.DesweepMetrics;
import com.desweep.core.model.DependencyRecord;
import com.desweep.core.model.DependencyType;
import com.desweep.core.model.MetadataCollection;
import com.desweep.core.model.TargetEntity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.desweep.core.loader.DatasetFixtures.dataset;
import static org.junit.jupiter.api.Assertions.*;

class DependencyScannerTest {

    private static final TargetEntity DE1 = new TargetEntity("DE1", "Customers", "obj-1");

    private SimpleMeterRegistry registry;
    private DependencyScanner scanner;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        scanner = new DependencyScanner(new DesweepMetrics(registry));
    }

    private static DependencyRecord only(List<DependencyRecord> records) {
        assertEquals(1, records.size(), () -> "expected one record but got " + records);
        return records.get(0);
    }

    @Test
    @DisplayName("an entity referenced nowhere has no dependencies")
    void noOccurrences() {
        BulkDataset dataset = dataset()
                .with(MetadataCollection.WORKFLOWS, "[{\"id\":\"w1\",\"name\":\"Other\",\"steps\":[]}]")
                .with(MetadataCollection.FILTERS, "[{\"filterActivityId\":\"f1\",\"sourceObjectId\":\"obj-2\"}]")
                .with(MetadataCollection.QUERIES, "[{\"queryDefinitionId\":\"q1\",\"targetKey\":\"DE2\",\"queryText\":\"SELECT 1\"}]")
                .with(MetadataCollection.IMPORTS, "[{\"importDefinitionId\":\"i1\",\"destinationObjectId\":\"obj-9\"}]")
                .with(MetadataCollection.TRIGGERED_MESSAGES, "[{\"definitionId\":\"t1\",\"name\":\"Welcome\"}]")
                .with(MetadataCollection.JOURNEYS, "[{\"id\":\"j1\",\"name\":\"Onboarding\"}]")
                .with(MetadataCollection.DATA_EXTRACTS, "[{\"id\":\"x1\",\"name\":\"Export\"}]")
                .build();

        assertTrue(scanner.scan(DE1, dataset).isEmpty());
    }

    @Nested
    @DisplayName("exact-field sources")
    class ExactFields {

        @Test
        @DisplayName("filter destination matches the entity's object id")
        void filterDestination() {
            BulkDataset dataset = dataset().with(MetadataCollection.FILTERS, """
                    [{"filterActivityId": "F", "name": "Active customers", "statusId": 1,
                      "sourceObjectId": "obj-0", "destinationObjectId": "OBJ-1"}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals(DependencyType.FILTER, record.type());
            assertEquals("F", record.id());
            assertEquals("Active customers", record.name());
            assertEquals("Active", record.status());
            assertEquals("Destination DE", record.detail());
            assertEquals(List.of(DE1), record.affectedEntities());
        }

        @Test
        @DisplayName("filter matching on both sides reports one combined label")
        void filterBothSides() {
            BulkDataset dataset = dataset().with(MetadataCollection.FILTERS, """
                    [{"id": "F", "statusId": 2, "sourceObjectId": "obj-1", "destinationObjectId": "obj-1"}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals("Source & Destination DE", record.detail());
            assertEquals("Status 2", record.status());
        }

        @Test
        @DisplayName("filters are not matched without an object id")
        void filterNeedsObjectId() {
            BulkDataset dataset = dataset().with(MetadataCollection.FILTERS,
                    "[{\"id\":\"F\",\"sourceObjectId\":\"DE1\"}]").build();

            assertTrue(scanner.scan(TargetEntity.ofKey("DE1"), dataset).isEmpty());
        }

        @Test
        @DisplayName("query target matches key in the nested SOAP shape")
        void queryTargetNested() {
            BulkDataset dataset = dataset().with(MetadataCollection.QUERIES, """
                    [{"ObjectID": "q1", "Name": "Build DE1", "Status": "Active",
                      "DataExtensionTarget": {"CustomerKey": "de1", "Name": "Customers"}}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals(DependencyType.QUERY, record.type());
            assertEquals("q1", record.id());
            assertEquals("Active", record.status());
            assertEquals("Query Target", record.detail());
            assertEquals("de1", record.rawMetadata().path("DataExtensionTarget.CustomerKey").asText());
        }

        @Test
        @DisplayName("query target matches name in the flattened REST shape")
        void queryTargetByName() {
            BulkDataset dataset = dataset().with(MetadataCollection.QUERIES, """
                    [{"queryDefinitionId": "q1", "name": "Refresh", "targetName": "CUSTOMERS"}]
                    """).build();

            assertEquals("Query Target", only(scanner.scan(DE1, dataset)).detail());
        }

        @Test
        @DisplayName("query text matching the entity name is reported by name")
        void sqlByName() {
            BulkDataset dataset = dataset().with(MetadataCollection.QUERIES, """
                    [{"queryDefinitionId": "Q", "name": "Segment", "targetKey": "Other",
                      "queryText": "SELECT email FROM [Customers] WHERE active = 1"}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals("Referenced in SQL (by Name)", record.detail());
        }

        @Test
        @DisplayName("query target and SQL text combine into one record")
        void targetAndText() {
            BulkDataset dataset = dataset().with(MetadataCollection.QUERIES, """
                    [{"queryDefinitionId": "Q", "targetKey": "DE1",
                      "queryText": "SELECT * FROM DE1 JOIN Customers c ON 1=1"}]
                    """).build();

            assertEquals("Query Target, Referenced in SQL (by Key), Referenced in SQL (by Name)",
                    only(scanner.scan(DE1, dataset)).detail());
        }

        @Test
        @DisplayName("import destination matches key or object id")
        void importDestination() {
            BulkDataset dataset = dataset().with(MetadataCollection.IMPORTS, """
                    [{"importDefinitionId": "i1", "name": "Nightly load", "destinationObjectId": "obj-1"},
                     {"ObjectID": "i2", "Name": "Legacy", "DestinationObject": {"CustomerKey": "DE1"}}]
                    """).build();

            var records = scanner.scan(DE1, dataset);
            assertEquals(List.of("i1", "i2"), records.stream().map(DependencyRecord::id).toList());
            assertTrue(records.stream().allMatch(r -> "Import Destination".equals(r.detail())));
        }
    }

    @Nested
    @DisplayName("triggered messages")
    class TriggeredMessages {

        @Test
        @DisplayName("audience field match is reported as the audience")
        void audience() {
            BulkDataset dataset = dataset().with(MetadataCollection.TRIGGERED_MESSAGES, """
                    [{"definitionId": "t1", "name": "Welcome", "status": "Active",
                      "subscriptions": {"dataExtension": "DE1"}}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals("Triggered Message Audience", record.detail());
            assertEquals("Active", record.status());
        }

        @Test
        @DisplayName("falls back to a serialized search when no audience field matches")
        void fallback() {
            BulkDataset dataset = dataset().with(MetadataCollection.TRIGGERED_MESSAGES, """
                    [{"definitionId": "t1", "name": "Receipt", "content": {"lookup": "Lookup('de1', 'x')"}}]
                    """).build();

            assertEquals("Referenced in Triggered Message", only(scanner.scan(DE1, dataset)).detail());
        }
    }

    @Nested
    @DisplayName("unstructured sources")
    class Unstructured {

        @Test
        @DisplayName("workflow with the key in its step data is found")
        void workflowSteps() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS, """
                    [{"id": "A", "name": "Workflow A", "status": "Scheduled",
                      "lastRunTime": "2024-04-27T00:00:00Z",
                      "steps": [{"activities": [{"name": "Refresh", "targetDataExtensions": [{"key": "DE1"}]}]}]}]
                    """).build();

            DependencyRecord record = only(scanner.scan(DE1, dataset));
            assertEquals(DependencyType.WORKFLOW, record.type());
            assertEquals("A", record.id());
            assertEquals("Referenced in Workflow", record.detail());
            assertEquals("2024-04-27T00:00:00Z", record.rawMetadata().path("lastRunTime").asText());
            assertFalse(record.rawMetadata().has("steps"), "projection keeps only summary fields");
        }

        @Test
        @DisplayName("journeys and data extracts match case-insensitively")
        void journeysAndExtracts() {
            BulkDataset dataset = dataset()
                    .with(MetadataCollection.JOURNEYS, "[{\"id\":\"j1\",\"name\":\"Onboarding\",\"defaults\":{\"email\":[\"{{Contact.Attribute.de1.Email}}\"]}}]")
                    .with(MetadataCollection.DATA_EXTRACTS, "[{\"dataExtractDefinitionId\":\"x1\",\"name\":\"Export\",\"dataFields\":[{\"name\":\"DECustomerKey\",\"value\":\"DE1\"}]}]")
                    .build();

            var records = scanner.scan(DE1, dataset);
            assertEquals(List.of(DependencyType.JOURNEY, DependencyType.DATA_EXTRACT),
                    records.stream().map(DependencyRecord::type).toList());
            assertEquals("x1", records.get(1).id());
            assertTrue(records.get(1).rawMetadata().has("dataFields"), "data extracts keep the whole record");
        }

        @Test
        @DisplayName("substring matching favours recall")
        void substringRecall() {
            BulkDataset dataset = dataset().with(MetadataCollection.WORKFLOWS,
                    "[{\"id\":\"w1\",\"name\":\"Uses DE10\"}]").build();

            assertEquals(1, scanner.scan(TargetEntity.ofKey("DE1"), dataset).size());
        }
    }

    @Test
    @DisplayName("malformed records are skipped and counted")
    void malformedSkipped() {
        BulkDataset dataset = dataset().with(MetadataCollection.FILTERS, """
                ["not an object", null, {"filterActivityId": "F", "destinationObjectId": "obj-1"}]
                """).build();

        DependencyRecord record = only(scanner.scan(DE1, dataset));
        assertEquals("F", record.id());

        var counter = registry.find("desweep.scan.malformed_records").tag("type", "FILTER").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("records without an id keep their name")
    void missingId() {
        BulkDataset dataset = dataset().with(MetadataCollection.JOURNEYS,
                "[{\"name\":\"Orphan journey DE1\"}]").build();

        DependencyRecord record = only(scanner.scan(DE1, dataset));
        assertNull(record.id());
        assertEquals("Orphan journey DE1", record.name());
        assertEquals("JOURNEY:name:Orphan journey DE1", record.key());
    }

    @Test
    @DisplayName("records without id or name are told apart by their position")
    void missingIdAndName() {
        BulkDataset dataset = dataset().with(MetadataCollection.QUERIES, """
                [{"queryText": "SELECT * FROM DE1"},
                 {"queryDefinitionId": "q2", "queryText": "SELECT 1"},
                 {"queryText": "SELECT Id FROM DE1 WHERE x = 1"}]
                """).build();

        List<DependencyRecord> records = scanner.scan(DE1, dataset);

        assertEquals(2, records.size());
        assertEquals("queries#0", records.get(0).origin());
        assertEquals("queries#2", records.get(1).origin());
        assertEquals("QUERY:at:queries#0", records.get(0).key());
        assertNotEquals(records.get(0).key(), records.get(1).key());
    }

    @Test
    @DisplayName("scanning is repeatable over the same dataset")
    void deterministic() {
        BulkDataset dataset = dataset()
                .with(MetadataCollection.QUERIES, "[{\"queryDefinitionId\":\"q\",\"queryText\":\"select * from DE1\"}]")
                .with(MetadataCollection.WORKFLOWS, "[{\"id\":\"w\",\"name\":\"DE1 loader\"}]")
                .build();

        assertEquals(scanner.scan(DE1, dataset), scanner.scan(DE1, dataset));
    }
}
