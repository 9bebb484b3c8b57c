package com.nexus.resolution.graph;

import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCanonicalStoreTest {

    private InMemoryCanonicalStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCanonicalStore();
    }

    private static CanonicalEntity person(String id, String normalizedName, String ingestionId) {
        return CanonicalEntity.builder()
                .id(id)
                .type(EntityType.PERSON)
                .primaryName(normalizedName)
                .normalizedName(normalizedName)
                .ingestionId(ingestionId)
                .build();
    }

    @Nested
    @DisplayName("Canonicals")
    class Canonicals {

        @Test
        @DisplayName("Created canonicals are indexed by blocking key, type and ingestion id")
        void testCreateAndFind() {
            store.createCanonical(person("c1", "marie eve girard", "ing-1"));

            assertEquals(1, store.findByBlockingKey(EntityType.PERSON, "tok:girard").size());
            assertTrue(store.findByBlockingKey(EntityType.ORGANIZATION, "tok:girard").isEmpty());
            assertEquals("c1", store.findByIngestionId("ing-1").orElseThrow());
            assertEquals(1, store.findByNormalizedName(EntityType.PERSON, "marie eve girard").size());
        }

        @Test
        @DisplayName("Aliases contribute blocking keys")
        void testAliasKeys() {
            CanonicalEntity entity = person("c1", "marie eve girard", "ing-1");
            entity.addAlias(Alias.of("Girard-Tremblay", "girard tremblay", "news", null));
            store.createCanonical(entity);

            assertEquals(1, store.findByBlockingKey(EntityType.PERSON, "tok:tremblay").size());
        }

        @Test
        @DisplayName("Reads return detached snapshots")
        void testSnapshots() {
            store.createCanonical(person("c1", "marie eve girard", "ing-1"));

            CanonicalEntity snapshot = store.findById("c1").orElseThrow();
            snapshot.putAttribute("city", "Montreal");

            assertNull(store.findById("c1").orElseThrow().getAttribute("city"));
        }

        @Test
        @DisplayName("Duplicate ids and unknown saves are write errors")
        void testWriteErrors() {
            store.createCanonical(person("c1", "marie eve girard", "ing-1"));

            assertThrows(GraphWriteException.class, () -> store.createCanonical(person("c1", "other", "ing-2")));
            assertThrows(GraphWriteException.class, () -> store.save(person("c9", "other", "ing-3")));
            assertThrows(GraphWriteException.class, () -> store.markMerged("c1", "c9"));
        }

        @Test
        @DisplayName("Merged canonicals leave blocking but keep resolving their ingestions")
        void testMarkMerged() {
            store.createCanonical(person("c1", "marie eve girard", "ing-1"));
            store.createCanonical(person("c2", "marie girard", "ing-2"));

            store.markMerged("c2", "c1");

            CanonicalEntity merged = store.findById("c2").orElseThrow();
            assertTrue(merged.isMerged());
            assertEquals("c1", merged.getMergedInto());
            assertEquals(List.of("c1"), store.findByBlockingKey(EntityType.PERSON, "tok:girard")
                    .stream().map(CanonicalEntity::getId).toList());
            assertEquals("c2", store.findByIngestionId("ing-2").orElseThrow());
            assertEquals(1, store.findActive(EntityType.PERSON).size());
        }

        @Test
        @DisplayName("Blocking set is deduplicated and capped")
        void testBlockingSet() {
            store.createCanonical(person("c1", "marie eve girard", "ing-1"));
            store.createCanonical(person("c2", "marie girard", "ing-2"));
            store.createCanonical(person("c3", "mario girardi", "ing-3"));

            List<CanonicalEntity> all = store.findBlockingSet(EntityType.PERSON,
                    List.of("pfx:mar", "tok:girard"), 10);
            List<CanonicalEntity> capped = store.findBlockingSet(EntityType.PERSON,
                    List.of("pfx:mar", "tok:girard"), 2);

            assertEquals(3, all.size());
            assertEquals(2, capped.size());
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @BeforeEach
        void createEntities() {
            store.createCanonical(person("a", "alice", "ing-a"));
            store.createCanonical(person("b", "bob", "ing-b"));
            store.createCanonical(person("c", "carol", "ing-c"));
        }

        @Test
        @DisplayName("Creating an existing edge keeps the higher confidence")
        void testEdgeConfidenceMax() {
            Relationship first = store.createRelationship("a", "WORKS_WITH", "b", 0.7, "doc-1");
            Relationship second = store.createRelationship("a", "WORKS_WITH", "b", 0.9, "doc-2");
            Relationship third = store.createRelationship("a", "WORKS_WITH", "b", 0.5, "doc-3");

            assertEquals(first.getId(), second.getId());
            assertEquals(0.9, third.getConfidence());
            assertEquals(1, store.findRelationships("a").size());
        }

        @Test
        @DisplayName("Repointing drops self-loops and folds duplicates")
        void testRepoint() {
            store.createRelationship("a", "KNOWS", "b", 0.8, null);
            store.createRelationship("b", "KNOWS", "c", 0.6, null);
            store.createRelationship("a", "KNOWS", "c", 0.9, null);

            List<Relationship> before = store.repointRelationships("b", "c");

            assertEquals(2, before.size());
            List<Relationship> after = store.findRelationships("c");
            assertEquals(1, after.size());
            assertTrue(after.get(0).sameEdge("a", "KNOWS", "c"));
            assertEquals(0.9, after.get(0).getConfidence());
            assertTrue(store.findRelationships("b").isEmpty());
        }

        @Test
        @DisplayName("Saved edges can be restored and deleted")
        void testSaveAndDelete() {
            Relationship edge = store.createRelationship("a", "KNOWS", "b", 0.8, null);
            store.deleteRelationship(edge.getId());
            assertTrue(store.findRelationships("a").isEmpty());

            store.saveRelationship(edge);
            assertEquals(edge.getId(), store.findRelationships("a").get(0).getId());
        }
    }
}
