package com.ssomonitor.detection.service.strategy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ssomonitor.detection.dto.Candidate;
import com.ssomonitor.detection.dto.CrawlAction;
import com.ssomonitor.detection.dto.info.CrawlingInfo;
import com.ssomonitor.detection.entity.LoginPageStrategyType;
import com.ssomonitor.detection.exception.MalformedFlowArtifactException;
import com.ssomonitor.detection.util.UrlHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns crawler output into CRAWLING candidates.
 *
 * <p>Layout: {@code <classified>/flow_<n>/page_<k>.png} holds the screenshots classified as login pages and
 * {@code <raw>/flow_<n>/click_actions_flow_<n>.json} the flow's action log. Flow and page numbers are
 * non-negative and positive decimal integers respectively; any other name in these directories is rejected.
 *
 * <p>The clicks leading to page k are the clicks logged before the first entry whose screenshot is
 * {@code page_<k>.png}; that entry's URL is the page URL. For each distinct URL the shortest click
 * sequence wins, ties keep the first one found in flow and page order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlFlowAnalyzer {

    static final Pattern FLOW_DIRECTORY = Pattern.compile("flow_(0|[1-9]\\d*)");
    static final Pattern PAGE_FILE = Pattern.compile("page_([1-9]\\d*)\\.png");

    private final ObjectMapper objectMapper;

    public List<Candidate> analyze(Path classifiedDirectory, Path rawDirectory) {
        if (!Files.isDirectory(classifiedDirectory)) {
            log.info("No classified crawler screenshots in {}", classifiedDirectory);
            return List.of();
        }

        Map<String, Candidate> shortest = new LinkedHashMap<>();
        for (NumberedPath flow : numbered(classifiedDirectory, FLOW_DIRECTORY, "flow_<n>", true)) {
            List<CrawlAction> actions = readActionLog(rawDirectory.resolve(flow.path().getFileName()), flow.number());
            for (NumberedPath page : numbered(flow.path(), PAGE_FILE, "page_<k>.png", false)) {
                Candidate candidate = candidateFor(flow.number(), page, actions);
                if (candidate == null) {
                    continue;
                }
                Candidate existing = shortest.get(candidate.url());
                if (existing == null || candidate.actions().size() < existing.actions().size()) {
                    shortest.put(candidate.url(), candidate);
                }
            }
        }
        log.info("Crawler output in {} yields {} distinct login pages", classifiedDirectory, shortest.size());
        return new ArrayList<>(shortest.values());
    }

    private Candidate candidateFor(int flow, NumberedPath page, List<CrawlAction> actions) {
        String pageFile = page.path().getFileName().toString();
        int index = -1;
        for (int i = 0; i < actions.size(); i++) {
            String screenshot = actions.get(i).screenshot();
            if (screenshot != null && pageFile.equals(Path.of(screenshot).getFileName().toString())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new MalformedFlowArtifactException("Action log of flow_" + flow + " has no entry for " + pageFile);
        }

        CrawlAction landing = actions.get(index);
        if (landing.url() == null || landing.url().isBlank()) {
            log.warn("Skipping {} of flow_{}: action log entry has no url", pageFile, flow);
            return null;
        }
        List<CrawlAction> clicks = actions.subList(0, index).stream()
                .filter(CrawlAction::hasClick)
                .collect(Collectors.toList());

        return Candidate.builder()
                .url(UrlHelper.normalize(landing.url()))
                .strategy(LoginPageStrategyType.CRAWLING)
                .priority(null)
                .info(new CrawlingInfo(flow, page.number(), clicks.size()))
                .actions(clicks)
                .build();
    }

    private List<CrawlAction> readActionLog(Path rawFlowDirectory, int flow) {
        Path actionLog = rawFlowDirectory.resolve("click_actions_flow_" + flow + ".json");
        try {
            return objectMapper.readValue(actionLog.toFile(), new TypeReference<List<CrawlAction>>() {});
        } catch (IOException e) {
            throw MalformedFlowArtifactException.unreadable(actionLog, e);
        }
    }

    private static List<NumberedPath> numbered(Path directory, Pattern pattern, String expected, boolean directories) {
        List<NumberedPath> result = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                String name = entry.getFileName().toString();
                if (name.startsWith(".") || Files.isDirectory(entry) != directories) {
                    continue;
                }
                Matcher matcher = pattern.matcher(name);
                if (!matcher.matches()) {
                    throw MalformedFlowArtifactException.badName(entry, expected);
                }
                result.add(new NumberedPath(Integer.parseInt(matcher.group(1)), entry));
            }
        } catch (IOException e) {
            throw MalformedFlowArtifactException.unreadable(directory, e);
        } catch (NumberFormatException e) {
            throw new MalformedFlowArtifactException("Number out of range in " + directory, e);
        }
        result.sort(Comparator.comparingInt(NumberedPath::number));
        return result;
    }

    private record NumberedPath(int number, Path path) {
    }
}
