package com.ssomonitor.detection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker settings bound from {@code worker.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "worker")
@Data
public class WorkerProperties {

    public static final String ROLE_CONSUMER = "consumer";
    public static final String ROLE_ANALYSIS = "analysis";

    private static final String TASK_QUEUE_SUFFIX = "_treq";

    /**
     * {@code consumer} runs the queue listener, {@code analysis} runs one isolated analysis and exits.
     */
    private String role = ROLE_CONSUMER;

    private Queue queue = new Queue();
    private Consumer consumer = new Consumer();
    private Executor executor = new Executor();
    private Oracle oracle = new Oracle();
    private Screenshot screenshot = new Screenshot();
    private Crawler crawler = new Crawler();
    private Searxng searxng = new Searxng();
    private Resolver resolver = new Resolver();
    private Delivery delivery = new Delivery();
    private Backend backend = new Backend();

    /**
     * Name of the analysis whose config/result keys the task document carries.
     * Defaults to the topic name without its {@code _treq} suffix.
     */
    public String getAnalysisName() {
        if (queue.getAnalysisName() != null && !queue.getAnalysisName().isBlank()) {
            return queue.getAnalysisName();
        }
        String topic = queue.getTopic();
        return topic.endsWith(TASK_QUEUE_SUFFIX)
                ? topic.substring(0, topic.length() - TASK_QUEUE_SUFFIX.length())
                : topic;
    }

    @Data
    public static class Queue {
        private String topic = "landscape_analysis_treq";
        private String groupId = "login-detection-worker";
        private String analysisName;
        /** Record header carrying the callback path */
        private String replyToHeader = "reply_to";
        /** Record header carrying the correlation id */
        private String correlationIdHeader = "correlation_id";
    }

    @Data
    public static class Consumer {
        /** Tasks processed concurrently before the listener is paused */
        private int maxInFlight = 1;
        private int workerPoolSize = 4;
    }

    @Data
    public static class Executor {
        private Duration deadline = Duration.ofHours(3);
        /** Java executable for the analysis process, defaults to the running JVM */
        private String javaCommand;
        private List<String> jvmOptions = new ArrayList<>();
        /** Directory for request/result exchange files */
        private String workDirectory = System.getProperty("java.io.tmpdir") + "/login-detection";
    }

    @Data
    public static class Oracle {
        /** {@code socket} or {@code chat-completion} */
        private String transport = "socket";
        private Socket socket = new Socket();
        private Chat chat = new Chat();
        /** Oracle timeout used by the metasearch strategy */
        private Duration metasearchTimeout = Duration.ofSeconds(120);

        @Data
        public static class Socket {
            private String host = "172.17.0.1";
            private int port = 5060;
            private Duration timeout = Duration.ofSeconds(60);
            /** Appends " noSave" so the oracle does not archive strategy screenshots */
            private boolean noSave = true;
        }

        @Data
        public static class Chat {
            private String baseUrl = "http://localhost:8000/v1";
            private String apiKey = "";
            private String model = "Qwen/Qwen2.5-VL-7B-Instruct";
            private int maxTokens = 512;
            private Duration timeout = Duration.ofSeconds(120);
            /** Public base URL under which screenshots are served to the model */
            private String imageBaseUrl = "http://localhost:8001";
            /** Path segment after which a screenshot path is relative to {@code imageBaseUrl} */
            private String pathMarker = "screenshot_flows";
            private Integer minPixels;
            private Integer maxPixels;
        }
    }

    @Data
    public static class Screenshot {
        /** Command invoked as {@code <command...> <url> <output-file>} */
        private List<String> command = new ArrayList<>(List.of("node", "screenshot.js"));
        private String directory = "screenshot_flows";
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Crawler {
        /** Command invoked as {@code <command...> <url>} */
        private List<String> command = new ArrayList<>(List.of("node", "crawler.js"));
        private String workingDirectory = ".";
        /** Where the crawler writes every flow */
        private String rawDirectory = "screenshot_flows";
        /** Where the triage service copies screenshots classified as login pages */
        private String classifiedDirectory = "output_images";
    }

    @Data
    public static class Searxng {
        private String baseUrl = "http://searxng:8080";
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Resolver {
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRedirects = 5;
    }

    @Data
    public static class Delivery {
        private Collector collector = new Collector();
        private Callback callback = new Callback();

        @Data
        public static class Collector {
            private String baseUrl = "http://localhost:8080";
            private String path = "/api/login_candidates";
            private Duration retryDelay = Duration.ofSeconds(5);
            private Duration timeout = Duration.ofSeconds(30);
        }

        @Data
        public static class Callback {
            private String brainUrl = "http://localhost:8000";
            private String username = "";
            private String password = "";
            private Duration retryBackoff = Duration.ofSeconds(60);
            private Duration timeout = Duration.ofSeconds(60);
        }
    }

    @Data
    public static class Backend {
        private Guidance guidance = new Guidance();
        private Triage triage = new Triage();

        @Data
        public static class Guidance {
            private boolean enabled = false;
            private String host = "0.0.0.0";
            private int port = 5000;
            private String baseUrl = "http://127.0.0.1:8002/v1";
            private String apiKey = "";
            private String model = "OS-Copilot/OS-Atlas-Base-7B";
            private Duration timeout = Duration.ofSeconds(120);
            /** Base URL under which the crawler's screenshots are served */
            private String imageBaseUrl = "http://localhost:8001";
            private String pathMarker = "screenshot_flows";
        }

        @Data
        public static class Triage {
            private boolean enabled = false;
            private String host = "0.0.0.0";
            private int port = 5060;
        }
    }
}
