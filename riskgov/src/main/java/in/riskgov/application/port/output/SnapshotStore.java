package in.riskgov.application.port.output;

import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Durable snapshot storage. Saves must be atomic: a reader sees the previous
 * snapshot or the new one, never a partial write.
 */
public interface SnapshotStore {

    /**
     * @throws in.riskgov.domain.common.PersistenceException on I/O failure
     */
    void saveStream(StreamSnapshot snapshot);

    /**
     * @throws in.riskgov.domain.common.PersistenceException on I/O failure
     */
    void saveGovernance(GovernanceSnapshot snapshot);

    /**
     * @return empty if absent or unreadable
     */
    Optional<StreamSnapshot> loadStream(String streamId);

    /**
     * @return empty if absent or unreadable
     */
    Optional<GovernanceSnapshot> loadGovernance();

    List<String> listStreams();
}
