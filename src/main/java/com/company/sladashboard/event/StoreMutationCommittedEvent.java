package com.company.sladashboard.event;

import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.StoreMutation;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class StoreMutationCommittedEvent {
    private final StoreMutation mutation;
    private final InvalidationParams params;
    private final List<String> affectedKeys;
}
