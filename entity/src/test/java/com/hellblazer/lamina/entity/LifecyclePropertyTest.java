package com.hellblazer.lamina.entity;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of entity lifecycles under arbitrary operation sequences and hierarchies.
 */
class LifecyclePropertyTest {

    enum Operation {
        INITIALIZE, START, MAP_INIT, QUEUE_DELETE, TICK, DELETE
    }

    private static EntityManager startedManager() {
        var manager = new EntityManager(new SimulationClock());
        manager.initialize();
        manager.startup();
        return manager;
    }

    @Property
    @Label("Entity life stage never moves backwards")
    void stageIsMonotonic(@ForAll @Size(max = 20) List<Operation> operations) {
        var manager = startedManager();
        var entity = manager.allocateEntity();
        var last = EntityLifeStage.ALLOCATED;

        for (var operation : operations) {
            try {
                switch (operation) {
                    case INITIALIZE -> manager.initializeEntity(entity);
                    case START -> manager.startEntity(entity);
                    case MAP_INIT -> manager.runMapInit(entity);
                    case QUEUE_DELETE -> manager.queueDeleteEntity(entity);
                    case TICK -> manager.tickUpdate();
                    case DELETE -> manager.deleteEntity(entity);
                }
            } catch (InvalidLifecycleTransitionException | UnknownIdException e) {
                // rejected transitions leave the stage untouched
            }
            var current = manager.entityExists(entity) ? manager.getLifeStage(entity) : EntityLifeStage.DELETED;
            assertTrue(current.isAtLeast(last), last + " -> " + current);
            last = current;
        }
    }

    @Property
    @Label("Deleting a root deletes every descendant and leaves no dangling child references")
    void deletingRootDeletesDescendants(@ForAll("parentChoices") List<Integer> parentChoices,
                                        @ForAll @IntRange(min = 0, max = 30) int victimChoice) {
        var manager = startedManager();
        var created = new ArrayList<EntityId>();
        created.add(manager.allocateEntity());
        for (var choice : parentChoices) {
            var entity = manager.allocateEntity();
            manager.getHierarchy().setParent(entity, created.get(choice % created.size()));
            created.add(entity);
        }
        var victim = created.get(victimChoice % created.size());
        var doomed = new HashSet<>(manager.getHierarchy().descendants(victim));
        doomed.add(victim);

        manager.deleteEntity(victim);

        for (var entity : created) {
            assertEquals(!doomed.contains(entity), manager.entityExists(entity));
        }
        for (var survivor : manager.getEntities()) {
            for (var child : manager.getHierarchy().getChildren(survivor)) {
                assertTrue(manager.entityExists(child));
            }
        }
        assertEquals(created.size() - doomed.size(), manager.getIdAllocator().getBindingCount());
    }

    @Provide
    Arbitrary<List<Integer>> parentChoices() {
        return Arbitraries.integers().between(0, 1000).list().ofMaxSize(25);
    }
}
