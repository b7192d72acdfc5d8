package com.company.sladashboard.event;

import com.company.sladashboard.domain.CacheStatus;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CacheRefreshedEvent {
    private final CacheStatus status;
    private final RefreshTrigger trigger;
}
