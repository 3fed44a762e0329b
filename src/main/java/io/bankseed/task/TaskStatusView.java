package io.bankseed.task;

import io.bankseed.model.TaskView;
import io.bankseed.progress.ProgressSnapshot;
import io.bankseed.validation.ValidationWarning;

import java.util.List;

public record TaskStatusView(TaskView task, ProgressSnapshot progress, List<ValidationWarning> warnings) {
}
