package dk.cloudcreate.essentials.domainpersistence.uow;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable configuration shared by all {@link UnitOfWork}'s created by a {@link UnitOfWorkFactory}
 */
public final class UnitOfWorkConfiguration {
    private final EventHarvestPolicy eventHarvestPolicy;

    private UnitOfWorkConfiguration(EventHarvestPolicy eventHarvestPolicy) {
        this.eventHarvestPolicy = requireNonNull(eventHarvestPolicy, "No eventHarvestPolicy provided");
    }

    /**
     * The default configuration, which uses {@link EventHarvestPolicy#ALWAYS}
     */
    public static UnitOfWorkConfiguration defaultConfiguration() {
        return new UnitOfWorkConfiguration(EventHarvestPolicy.ALWAYS);
    }

    public UnitOfWorkConfiguration withEventHarvestPolicy(EventHarvestPolicy eventHarvestPolicy) {
        return new UnitOfWorkConfiguration(eventHarvestPolicy);
    }

    public EventHarvestPolicy eventHarvestPolicy() {
        return eventHarvestPolicy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitOfWorkConfiguration)) return false;
        return eventHarvestPolicy == ((UnitOfWorkConfiguration) o).eventHarvestPolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventHarvestPolicy);
    }

    @Override
    public String toString() {
        return "UnitOfWorkConfiguration{" +
                "eventHarvestPolicy=" + eventHarvestPolicy +
                '}';
    }
}
