package com.ssomonitor.detection.client;

import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.ScreenshotException;

import java.nio.file.Path;

/**
 * Renders a page in a headless browser and stores a screenshot of it.
 */
public interface ScreenshotCapturer {

    /**
     * @return path of the written PNG
     * @throws ScreenshotException if the page could not be captured
     */
    Path capture(String url, LoginPageStrategyType strategy);
}
