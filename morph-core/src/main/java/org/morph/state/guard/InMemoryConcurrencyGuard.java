package org.morph.state.guard;

import org.morph.exception.AlreadyActiveException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local guard for embedded use where every caller shares one JVM.
 */
public class InMemoryConcurrencyGuard implements ConcurrencyGuard {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    @Override
    public GuardLease acquire(String schemaName) {
        if (!held.add(schemaName)) {
            throw new AlreadyActiveException(schemaName, "acquire migration lock");
        }
        return new Lease(schemaName);
    }

    public boolean isHeld(String schemaName) {
        return held.contains(schemaName);
    }

    private final class Lease implements GuardLease {
        private final String schemaName;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String schemaName) {
            this.schemaName = schemaName;
        }

        @Override
        public String schemaName() {
            return schemaName;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                held.remove(schemaName);
            }
        }
    }
}
