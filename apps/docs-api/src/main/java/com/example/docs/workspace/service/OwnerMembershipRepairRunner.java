package com.example.docs.workspace.service;

import com.example.docs.config.properties.DocsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

// Runs the owner membership repair once at startup when enabled
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docs.maintenance.repair-owner-memberships.enabled", havingValue = "true")
public class OwnerMembershipRepairRunner implements ApplicationRunner {

    private static final Duration TIMEOUT = Duration.ofMinutes(5);

    private final OwnerMembershipRepairService repairService;
    private final DocsProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        DocsProperties.RepairOwnerMemberships settings = properties.maintenance().repairOwnerMemberships();
        log.info("Starting owner membership repair: dryRun={}, workspace={}",
                settings.dryRun(), settings.workspaceSlug() != null ? settings.workspaceSlug() : "all");
        repairService.repair(settings.dryRun(), settings.workspaceSlug()).block(TIMEOUT);
    }
}
