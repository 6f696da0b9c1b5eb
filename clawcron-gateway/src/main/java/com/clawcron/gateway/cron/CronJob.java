package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted cron job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronJob {
    private String id;
    /** Agent whose main session receives system events; null for the default agent. */
    private String agentId;
    private String name;
    private String description;
    @Builder.Default
    private boolean enabled = true;
    /** One-shot jobs only: delete instead of disabling after a successful run. */
    private Boolean deleteAfterRun;
    private long createdAtMs;
    private long updatedAtMs;
    private CronTypes.CronSchedule schedule;
    private CronTypes.SessionTarget sessionTarget;
    private CronTypes.WakeMode wakeMode;
    private CronTypes.CronPayload payload;
    private CronTypes.CronIsolation isolation;
    @Builder.Default
    private CronTypes.CronJobState state = new CronTypes.CronJobState();
}
