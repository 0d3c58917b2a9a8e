package ai.scholar.outline.structure;

import ai.scholar.outline.model.Address;
import java.util.Optional;

/**
 * Result of assembling the hierarchical outline: either completed, or stopped at the first section address that
 * could not be placed in the open section chain.
 *
 * @param offendingAddress address of the block that could not be placed
 * @param blockPosition    zero-based position of that block in the body stream, {@code -1} when completed
 */
public record AssemblyOutcome(Optional<Address> offendingAddress, int blockPosition) {

    private static final AssemblyOutcome COMPLETED = new AssemblyOutcome(Optional.empty(), -1);

    public AssemblyOutcome {
        offendingAddress = offendingAddress == null ? Optional.empty() : offendingAddress;
    }

    public static AssemblyOutcome completed() {
        return COMPLETED;
    }

    public static AssemblyOutcome inconsistent(Address address, int blockPosition) {
        return new AssemblyOutcome(Optional.of(address), blockPosition);
    }

    public boolean isCompleted() {
        return offendingAddress.isEmpty();
    }
}
