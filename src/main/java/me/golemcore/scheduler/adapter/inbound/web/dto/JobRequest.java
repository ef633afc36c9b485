package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.scheduler.domain.model.JobDraft;
import me.golemcore.scheduler.domain.model.JobOptions;
import me.golemcore.scheduler.domain.model.JobSchedule;

import java.util.Map;

/**
 * Body of job create and update requests. On update, omitted fields keep
 * their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    private String name;
    private String task;
    private Map<String, Object> params;
    private JobSchedule schedule;
    private JobOptions options;

    public JobDraft toDraft() {
        return JobDraft.builder()
                .name(name)
                .taskName(task)
                .params(params)
                .schedule(schedule)
                .options(options)
                .build();
    }
}
