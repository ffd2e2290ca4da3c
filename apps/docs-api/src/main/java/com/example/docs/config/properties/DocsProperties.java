package com.example.docs.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "docs")
public record DocsProperties(
        GatewayProperties gateway,
        AuditProperties audit,
        MaintenanceProperties maintenance
) {
    public DocsProperties {
        if (gateway == null) {
            gateway = new GatewayProperties(null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(true, 500);
        }
        if (maintenance == null) {
            maintenance = new MaintenanceProperties(null);
        }
    }

    /**
     * Headers set by the upstream gateway after it has authenticated the caller.
     */
    public record GatewayProperties(
            String userIdHeader,
            String userEmailHeader
    ) {
        public GatewayProperties {
            if (userIdHeader == null || userIdHeader.isBlank()) {
                userIdHeader = "X-User-Id";
            }
            if (userEmailHeader == null || userEmailHeader.isBlank()) {
                userEmailHeader = "X-User-Email";
            }
        }
    }

    public record AuditProperties(
            boolean structuredLogEnabled,
            int maxUserAgentLength
    ) {
        public AuditProperties {
            if (maxUserAgentLength <= 0) {
                maxUserAgentLength = 500;
            }
        }
    }

    public record MaintenanceProperties(
            RepairOwnerMemberships repairOwnerMemberships
    ) {
        public MaintenanceProperties {
            if (repairOwnerMemberships == null) {
                repairOwnerMemberships = new RepairOwnerMemberships(false, false, null);
            }
        }
    }

    /**
     * Startup job that gives every workspace owner an active admin membership.
     *
     * @param enabled       run the job on startup
     * @param dryRun        report what would change without writing
     * @param workspaceSlug restrict the job to one workspace
     */
    public record RepairOwnerMemberships(
            boolean enabled,
            boolean dryRun,
            String workspaceSlug
    ) {}
}
