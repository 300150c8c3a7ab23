package in.riskgov.application.port.output;

import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;

/**
 * Hands immutable snapshots to the write-behind persistence task. Implementations
 * must return immediately; the decision path never waits for I/O.
 */
public interface SnapshotPublisher {

    void publish(StreamSnapshot snapshot);

    void publish(GovernanceSnapshot snapshot);

    SnapshotPublisher DISCARD = new SnapshotPublisher() {
        @Override
        public void publish(StreamSnapshot snapshot) {
        }

        @Override
        public void publish(GovernanceSnapshot snapshot) {
        }
    };
}
