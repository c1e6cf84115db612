package com.ssomonitor.detection.service.strategy;

import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.entity.LoginPageStrategyType;

import java.util.List;

/**
 * One independent way of discovering login page candidates for a domain.
 * An empty list is a valid outcome.
 */
public interface LoginPageStrategy {

    LoginPageStrategyType type();

    List<Candidate> discover(StrategyContext context);
}
