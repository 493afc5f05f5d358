package com.example.cruisesync.api.controller;

import com.example.cruisesync.api.request.CreateSyncTaskRequest;
import com.example.cruisesync.api.response.ApiResponse;
import com.example.cruisesync.api.response.CreateSyncTaskResponse;
import com.example.cruisesync.api.response.SyncTaskDetailResponse;
import com.example.cruisesync.application.service.SyncTaskService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sync/tasks")
public class SyncTaskController {

    private final SyncTaskService syncTaskService;

    public SyncTaskController(SyncTaskService syncTaskService) {
        this.syncTaskService = syncTaskService;
    }

    @PostMapping
    public ApiResponse<CreateSyncTaskResponse> createTask(@Valid @RequestBody CreateSyncTaskRequest request) {
        return ApiResponse.success(syncTaskService.createCrawlTask(request));
    }

    @GetMapping("/{id}")
    public ApiResponse<SyncTaskDetailResponse> getTask(@PathVariable("id") Long id) {
        SyncTaskDetailResponse response = syncTaskService.getTask(id);
        if (response == null) {
            return ApiResponse.notFound("Task " + id + " not found");
        }
        return ApiResponse.success(response);
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<String> cancelTask(@PathVariable("id") Long id) {
        boolean canceled = syncTaskService.cancelTask(id);
        if (!canceled) {
            return ApiResponse.notFound("Task " + id + " not found");
        }
        return ApiResponse.success("CANCELED");
    }
}
