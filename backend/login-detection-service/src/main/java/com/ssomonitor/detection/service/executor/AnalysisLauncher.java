package com.ssomonitor.detection.service.executor;

import com.ssomonitor.detection.dto.TaskMessage;
import com.ssomonitor.detection.exception.AnalysisLaunchException;

/**
 * Starts the analysis of one task in an execution context that can be killed from outside.
 */
public interface AnalysisLauncher {

    /**
     * @throws AnalysisLaunchException if the isolated context cannot be created
     */
    RunningAnalysis launch(TaskMessage task);
}
