package com.delta.searchsync.sync.service;

import com.delta.searchsync.config.SearchSyncProperties;
import com.delta.searchsync.sync.model.DeployRequest;
import com.delta.searchsync.sync.model.DeploySummary;
import com.delta.searchsync.sync.model.IndexDeployResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final SearchSyncProperties properties;
    private final SearchDeployService deployService;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        SearchSyncProperties properties,
        SearchDeployService deployService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.deployService = deployService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> indices = Arrays.stream(properties.getCli().getIndices().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        DeploySummary summary = deployService.deploy(new DeployRequest(indices, properties.getCli().isOnlyImport()));
        for (IndexDeployResult result : summary.indices()) {
            log.info(
                "Summary {}: estimated={}, indexed={}, indexFailures={}, deleted={}, elapsedMs={}",
                result.index(),
                result.estimatedRows(),
                result.imported().processed(),
                result.imported().failed(),
                result.cleanedUp().failed(),
                result.elapsed().toMillis()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
