package com.company.sladashboard.dto.request;

import com.company.sladashboard.domain.enums.TaskPriority;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskPriorityRequest {

    @NotNull(message = "Priority is required")
    private TaskPriority priority;
}
