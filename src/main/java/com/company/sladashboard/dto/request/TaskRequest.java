package com.company.sladashboard.dto.request;

import com.company.sladashboard.domain.enums.TaskPriority;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    @Size(max = 255)
    private String name;

    private String description;

    private TaskPriority priority;

    private String status;
}
