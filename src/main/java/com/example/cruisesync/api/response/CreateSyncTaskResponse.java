package com.example.cruisesync.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateSyncTaskResponse {

    private Long taskId;
    private String status;
}
