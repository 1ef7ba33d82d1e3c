package br.edu.ifba.graphqa.centrality;

import br.edu.ifba.graphqa.GraphFixtures;
import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.QueryValidationException;
import br.edu.ifba.graphqa.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CentralityServiceTest {

    private InMemoryGraphStorage storage;
    private CentralityService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
        storage.initialize().join();
        service = new CentralityService(storage, new CentralityCalculator(CentralityOptions.defaults()));
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    @DisplayName("should store scores and report ranked entities with percentiles")
    void shouldRecomputeWholeGraph() {
        GraphFixtures.seedCarterGraph(storage);

        CentralityReport report = service.recompute(null, 10);

        assertEquals(4, report.entitiesProcessed());
        assertEquals(4, report.scoresStored());
        assertEquals(4, report.topEntities().size());
        assertTrue(report.converged());
        assertEquals(0.95, report.confidence());
        assertEquals(1, report.topEntities().get(0).rank());
        assertEquals(100.0, report.topEntities().get(0).percentile());
        assertEquals(25.0, report.topEntities().get(3).percentile());
        assertEquals("Carter Center", report.topEntities().get(0).canonicalName());
        assertEquals(4, storage.getStats().join().scoredEntityCount());

        Entity stored = storage.getEntity("o1").join();
        assertNotNull(stored.getCentralityScore());
        assertEquals(report.topEntities().get(0).score(), stored.getCentralityScore(), 1e-12);
    }

    @Test
    @DisplayName("should replace only the scores of the filtered subset")
    void shouldReplaceSubsetScores() {
        GraphFixtures.seedCarterGraph(storage);
        service.recompute(null, null);
        double centerBefore = storage.getEntity("o1").join().getCentralityScore();

        CentralityReport report = service.recompute("person", 5);

        assertEquals("person", report.entityType());
        assertEquals(2, report.entitiesProcessed());
        assertEquals(0.5, storage.getEntity("p1").join().getCentralityScore(), 1e-6);
        assertEquals(0.5, storage.getEntity("p2").join().getCentralityScore(), 1e-6);
        assertEquals(centerBefore, storage.getEntity("o1").join().getCentralityScore());
    }

    @Test
    @DisplayName("should list top entities by stored score")
    void shouldListTopEntities() {
        GraphFixtures.seedCarterGraph(storage);
        service.recompute(null, null);

        List<Entity> top = service.topEntities(2, null);
        List<Entity> people = service.topEntities(10, "PERSON");

        assertEquals(2, top.size());
        assertEquals("o1", top.get(0).getId());
        assertTrue(top.get(0).getCentralityScore() >= top.get(1).getCentralityScore());
        assertEquals(2, people.size());
        assertTrue(people.stream().allMatch(e -> e.getEntityType().equals("PERSON")));
    }

    @Test
    @DisplayName("should reject a malformed type tag")
    void shouldRejectMalformedType() {
        GraphFixtures.seedCarterGraph(storage);

        assertThrows(QueryValidationException.class, () -> service.recompute("PERSON'; DROP TABLE entities", 5));
        assertThrows(QueryValidationException.class, () -> service.topEntities(5, "per-son"));
    }

    @Test
    @DisplayName("should refuse to compute over an empty graph or subset")
    void shouldRefuseEmptyGraph() {
        assertThrows(GraphEmptyException.class, () -> service.recompute(null, 10));

        GraphFixtures.seedCarterGraph(storage);
        assertThrows(GraphEmptyException.class, () -> service.recompute("EVENT", 10));
    }
}
