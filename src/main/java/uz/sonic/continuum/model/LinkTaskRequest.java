package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code task_id} of {@code null} unlinks the contribution from its task.
 */
public record LinkTaskRequest(@JsonProperty("task_id") Long taskId) {}
