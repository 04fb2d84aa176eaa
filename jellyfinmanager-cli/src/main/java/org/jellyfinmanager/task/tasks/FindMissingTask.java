package org.jellyfinmanager.task.tasks;

import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.MissingEpisodeSummary;
import org.jellyfinmanager.model.enums.TaskType;
import org.jellyfinmanager.service.missing.MissingEpisodeService;
import org.springframework.stereotype.Component;

@Component
public class FindMissingTask extends AbstractTask {

    private final MissingEpisodeService missingEpisodeService;

    public FindMissingTask(AppProperties appProperties, MissingEpisodeService missingEpisodeService) {
        super(appProperties);
        this.missingEpisodeService = missingEpisodeService;
    }

    @Override
    public void validateConfiguration() {
        super.validateConfiguration();
        if (StringUtils.isBlank(appProperties.getTvdb().getApiKey())) {
            throw ApiError.MISSING_CONFIGURATION.createException("TVDB API key (use --tvdb-apikey or set TVDB_API_KEY)");
        }
    }

    @Override
    protected String run() {
        MissingEpisodeSummary summary = missingEpisodeService.findMissingEpisodes(appProperties.isIncludeSpecials());
        return String.format("Found %d missing episodes in %d series", summary.totalMissing(), summary.seriesChecked());
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.FIND_MISSING;
    }
}
