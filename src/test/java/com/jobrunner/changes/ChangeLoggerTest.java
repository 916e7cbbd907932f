package com.jobrunner.changes;

import com.jobrunner.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for change attribution and listener notification.
 */
public class ChangeLoggerTest {

    private final List<ObjectChange> stored = new ArrayList<>();
    private final ChangeLogger changeLogger = new ChangeLogger(stored::add, Clock.systemUTC());

    private static Fixtures.Item device() {
        return new Fixtures.Item("dcim.device", "d1", "edge-01");
    }

    @Test
    public void testChangeUsesScopedContext() {
        ObjectChange change;
        try (ChangeLogging.Scope scope = ChangeLogging.open(ChangeContext.job("alice", "plugins/tests/Echo", "result-1"))) {
            change = changeLogger.recordChange(device(), ChangeAction.UPDATE);
        }

        assertEquals(ChangeContextType.JOB, change.getContextType());
        assertEquals("alice", change.getUser());
        assertEquals("result-1", change.getRequestId());
        assertEquals("plugins/tests/Echo", change.getContextDetail());
        assertEquals("dcim.device", change.getChangedObjectType());
        assertEquals("d1", change.getChangedObjectId());
        assertEquals(List.of(change), stored);
        assertNull(ChangeLogging.current());
    }

    @Test
    public void testChangeOutsideScopeIsUnknown() {
        ObjectChange change = changeLogger.recordChange(device(), ChangeAction.CREATE);

        assertEquals(ChangeContextType.UNKNOWN, change.getContextType());
        assertNull(change.getUser());
    }

    @Test
    public void testScopesNest() {
        ChangeContext outer = ChangeContext.web("alice");
        ChangeContext inner = ChangeContext.jobHook("alice", "plugins/hooks/Audit", "result-2");

        try (ChangeLogging.Scope outerScope = ChangeLogging.open(outer)) {
            try (ChangeLogging.Scope innerScope = ChangeLogging.open(inner)) {
                assertSame(inner, ChangeLogging.current());
            }
            assertSame(outer, ChangeLogging.current());
        }
        assertNull(ChangeLogging.current());
    }

    @Test
    public void testFailingListenerDoesNotStopOthers() {
        List<ObjectChange> seen = new ArrayList<>();
        changeLogger.addListener(change -> {
            throw new IllegalStateException("listener broke");
        });
        changeLogger.addListener(seen::add);

        ObjectChange change = changeLogger.recordChange(device(), ChangeAction.DELETE, ChangeContext.web("bob"));

        assertEquals(List.of(change), seen);
        assertEquals("edge-01 deleted by bob", change.getDisplay());
    }
}
