package io.cronkeeper.core.job;

public record JobDetail(Job job, String alertTitle, int alertCount, String alertMethod) {
    public JobDetail {
        alertTitle = alertTitle == null ? "" : alertTitle;
        alertMethod = alertMethod == null ? "" : alertMethod;
    }
}
