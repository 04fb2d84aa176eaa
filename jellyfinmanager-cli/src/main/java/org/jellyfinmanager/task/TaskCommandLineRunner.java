package org.jellyfinmanager.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jellyfinmanager.exception.APIException;
import org.jellyfinmanager.model.dto.TaskResult;
import org.jellyfinmanager.model.enums.TaskStatus;
import org.jellyfinmanager.model.enums.TaskType;
import org.jellyfinmanager.task.tasks.Task;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Selects the task named on the command line ({@code --backup}, {@code --restore} or
 * {@code --find-missing}) and runs it. The process exit code is 1 when no task was selected or the
 * task failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
            Usage:
              Backup:        jellyfinmanager --backup --server=URL --apikey=KEY --user=NAME [--file=backup.json]
              Restore:       jellyfinmanager --restore --server=URL --apikey=KEY --user=NAME [--file=backup.json]
              Find Missing:  jellyfinmanager --find-missing --server=URL --apikey=KEY --user=NAME --tvdb-apikey=KEY [--include-specials]

            Or set environment variables:
              JELLYFIN_SERVER, JELLYFIN_API_KEY, JELLYFIN_USER, TVDB_API_KEY""";

    private final List<Task> tasks;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        Optional<TaskType> taskType = Arrays.stream(TaskType.values())
                .filter(type -> args.containsOption(type.getOption()))
                .findFirst();
        if (taskType.isEmpty()) {
            log.error("Error: Please specify --backup, --restore, or --find-missing\n{}", USAGE);
            exitCode = 1;
            return;
        }

        Task task = findTask(taskType.get());
        try {
            task.validateConfiguration();
        } catch (APIException e) {
            log.error("Error: {}\n{}", e.getMessage(), USAGE);
            exitCode = 1;
            return;
        }

        TaskResult result = task.execute();
        if (result.getStatus() == TaskStatus.FAILED) {
            exitCode = 1;
        } else {
            log.info("{}: {}", result.getTaskType(), result.getMessage());
        }
    }

    private Task findTask(TaskType taskType) {
        return tasks.stream()
                .filter(task -> task.getTaskType() == taskType)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No task registered for " + taskType));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
