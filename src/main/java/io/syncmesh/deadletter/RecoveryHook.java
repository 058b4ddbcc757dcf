package io.syncmesh.deadletter;

@FunctionalInterface
public interface RecoveryHook {
    // true removes the entry; false or an exception keeps it for the next pass.
    boolean recover(DeadLetterEntry entry) throws Exception;
}
