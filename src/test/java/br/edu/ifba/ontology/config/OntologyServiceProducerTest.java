package br.edu.ifba.ontology.config;

import br.edu.ifba.ontology.core.QueryOutcome;
import br.edu.ifba.ontology.core.QueryResult;
import br.edu.ifba.ontology.core.Question;
import br.edu.ifba.ontology.ingestion.CsvRecordSource;
import br.edu.ifba.ontology.ingestion.IngestionPipeline;
import br.edu.ifba.ontology.ingestion.IngestionReport;
import br.edu.ifba.ontology.ingestion.RecordKind;
import br.edu.ifba.ontology.query.QueryEngine;
import br.edu.ifba.ontology.query.QueryOrchestrator;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.HealthStatus;
import br.edu.ifba.ontology.storage.impl.GuardedGraphStorage;
import io.quarkus.test.junit.QuarkusTest;
import io.smallrye.faulttolerance.api.CircuitBreakerState;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application and checks the wiring end to end: configuration reaches the
 * components, and records loaded through the pipeline are visible to queries.
 */
@QuarkusTest
class OntologyServiceProducerTest {

    @Inject
    OntologyConfig config;

    @Inject
    GraphStoragePort storage;

    @Inject
    QueryEngine engine;

    @Inject
    QueryOrchestrator orchestrator;

    @Inject
    IngestionPipeline pipeline;

    @Test
    @DisplayName("test configuration is bound to the components")
    void testConfigurationApplied() {
        assertEquals(5, config.query().maxDepth());
        assertEquals(5, engine.getSettings().maxDepth());
        assertEquals(Duration.ofSeconds(2), engine.getSettings().timeout());
        assertEquals(10, pipeline.getSettings().batchSize());
        assertEquals(2, pipeline.getSettings().workers());
    }

    @Test
    @DisplayName("the exposed storage port is guarded by the breaker")
    void testGuardedStorage() {
        assertInstanceOf(GuardedGraphStorage.class, storage);
        assertEquals(OntologyServiceProducer.BREAKER_NAME, ((GuardedGraphStorage) storage).getName());
        assertEquals(CircuitBreakerState.CLOSED, ((GuardedGraphStorage) storage).breakerState());
        assertEquals(Duration.ofMillis(500), config.breaker().callTimeout());
        assertEquals(HealthStatus.HEALTHY, orchestrator.health().join());
    }

    @Test
    @DisplayName("CSV loaded through the pipeline answers questions")
    void testIngestThenQuery() throws Exception {
        String csv = """
            head_entity,tail_entity,edge_type,confidence
            wiring_dog,wiring_animal,SubclassOf,0.9
            wiring_fido,wiring_dog,InstanceOf,1.0
            wiring_university,wiring_educational,HasAttribute,1.0
            wiring_college,wiring_university,SubclassOf,0.8
            """;
        Question fido = Question.instanceOf("wiring_fido", "wiring_animal");

        QueryResult before = orchestrator.ask(fido).get(5, TimeUnit.SECONDS);
        assertEquals(QueryOutcome.NO, before.outcome());

        IngestionReport report = pipeline.run(
                new CsvRecordSource(new StringReader(csv), RecordKind.RELATIONSHIP, "wiring.csv", 3))
            .get(10, TimeUnit.SECONDS);
        assertEquals(4, report.relationshipsWritten());

        QueryResult after = orchestrator.ask(fido).get(5, TimeUnit.SECONDS);
        assertEquals(QueryOutcome.YES, after.outcome());
        assertEquals(0.9, after.confidence(), 1e-12);
        assertFalse(after.cacheHit());

        QueryResult attribute = orchestrator.ask(Question.hasAttribute("wiring_college", "wiring_educational"))
            .get(5, TimeUnit.SECONDS);
        assertEquals(0.8, attribute.confidence(), 1e-12);

        assertTrue(orchestrator.ask(fido).get(5, TimeUnit.SECONDS).cacheHit());
    }
}
