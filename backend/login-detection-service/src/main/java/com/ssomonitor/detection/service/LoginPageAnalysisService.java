package com.ssomonitor.detection.service;

import com.ssomonitor.detection.client.ClassificationOracle;
import com.ssomonitor.detection.dto.AnalysisResult;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.LoginPageAnalysisConfig;
import com.ssomonitor.detection.dto.ResolvedTarget;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.service.strategy.LoginPageStrategy;
import com.ssomonitor.detection.service.strategy.StrategyContext;
import com.ssomonitor.detection.util.MdcContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the strategies named in the task's scope, in that order, against the resolved landing URL and
 * concatenates their candidates.
 *
 * <p>A failing strategy aborts the analysis only while nothing has been found yet. Once another strategy
 * contributed candidates the failure is logged, recorded under {@code strategy_errors} and the remaining
 * strategies still run.
 */
@Service
@Slf4j
public class LoginPageAnalysisService {

    private final Map<LoginPageStrategyType, LoginPageStrategy> strategies = new EnumMap<>(LoginPageStrategyType.class);
    private final TargetResolver targetResolver;
    private final ClassificationOracle oracle;

    public LoginPageAnalysisService(List<LoginPageStrategy> strategies, TargetResolver targetResolver,
                                    ClassificationOracle oracle) {
        for (LoginPageStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.targetResolver = targetResolver;
        this.oracle = oracle;
    }

    public AnalysisResult analyze(String domain, LoginPageAnalysisConfig config) {
        LoginPageAnalysisConfig effective = config == null ? LoginPageAnalysisConfig.defaults() : config;
        ResolvedTarget resolved = targetResolver.resolve(domain);
        AnalysisResult result = AnalysisResult.forTarget(resolved);
        StrategyContext context = new StrategyContext(domain, resolved, effective, oracle, result);

        List<LoginPageStrategyType> scope = effective.loginPageConfig().strategyScope();
        log.info("Starting login page analysis of {} with strategies {}", domain, scope);

        for (LoginPageStrategyType type : scope) {
            LoginPageStrategy strategy = strategies.get(type);
            if (strategy == null) {
                log.warn("No implementation for strategy {}, skipping", type);
                continue;
            }
            MdcContext.setStrategy(type.name());
            try {
                List<Candidate> found = strategy.discover(context);
                result.addCandidates(found);
                log.info("Strategy {} contributed {} candidates", type, found.size());
            } catch (RuntimeException e) {
                if (result.candidatesOrEmpty().isEmpty()) {
                    throw e;
                }
                log.error("Strategy {} failed for {}, keeping {} earlier candidates: {}",
                        type, domain, result.candidatesOrEmpty().size(), e.getMessage(), e);
                result.recordStrategyError(type.name(), e.getMessage());
            } finally {
                MdcContext.clearStrategy();
            }
        }

        log.info("Login page analysis of {} finished with {} candidates", domain, result.candidatesOrEmpty().size());
        return result;
    }
}
