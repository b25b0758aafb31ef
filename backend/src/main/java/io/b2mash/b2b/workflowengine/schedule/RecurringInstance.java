package io.b2mash.b2b.workflowengine.schedule;

import io.b2mash.b2b.workflowengine.task.Task;

/**
 * A recurring occurrence returned by {@link RecurringInstanceFactory}.
 *
 * @param created false when the occurrence already existed and was returned as-is
 */
public record RecurringInstance(Task task, boolean created) {}
