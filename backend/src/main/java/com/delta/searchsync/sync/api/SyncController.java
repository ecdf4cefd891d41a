package com.delta.searchsync.sync.api;

import com.delta.searchsync.sync.model.BatchResult;
import com.delta.searchsync.sync.model.DeployRequest;
import com.delta.searchsync.sync.model.DeploySummary;
import com.delta.searchsync.sync.service.SearchDeployService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final SearchDeployService deployService;

    public SyncController(SearchDeployService deployService) {
        this.deployService = deployService;
    }

    @PostMapping("/{index}/import")
    public BatchResult importIndex(@PathVariable("index") String index) {
        return deployService.importIndex(index);
    }

    @PostMapping("/{index}/cleanup")
    public BatchResult cleanUpIndex(@PathVariable("index") String index) {
        return deployService.cleanUpIndex(index);
    }

    @GetMapping("/{index}/estimate")
    public Map<String, Object> estimate(@PathVariable("index") String index) {
        return Map.of("index", index, "estimatedRows", deployService.estimate(index), "exact", false);
    }

    @PostMapping("/deploy")
    public DeploySummary deploy(@RequestBody(required = false) DeployRequest request) {
        return deployService.deploy(request == null ? new DeployRequest(List.of(), false) : request);
    }
}
