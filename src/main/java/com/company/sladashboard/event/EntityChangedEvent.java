package com.company.sladashboard.event;

import com.company.sladashboard.domain.EntityChange;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Published after an incremental update has been installed in a new snapshot.
 */
@Getter
@AllArgsConstructor
public class EntityChangedEvent {
    private final EntityChange change;
    private final long snapshotVersion;
}
