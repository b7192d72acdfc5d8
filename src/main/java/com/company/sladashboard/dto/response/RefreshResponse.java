package com.company.sladashboard.dto.response;

import com.company.sladashboard.domain.CacheStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshResponse {
    private String message;
    private CacheStatus status;
}
