package com.jobagents.app;

import com.jobagents.agents.CoverLetterAgent;
import com.jobagents.agents.JobFetcherAgent;
import com.jobagents.agents.ResumeAgent;
import com.jobagents.client.AdzunaListingSource;
import com.jobagents.client.BackendApiClient;
import com.jobagents.client.HttpJson;
import com.jobagents.client.PackageStore;
import com.jobagents.client.TextDocumentWriter;
import com.jobagents.core.BaseAgent;
import com.jobagents.core.StepOutcome;
import com.jobagents.db.Database;
import com.jobagents.db.PackageRepository;
import com.jobagents.engine.ReadinessCheck;
import com.jobagents.engine.ScheduledTask;
import com.jobagents.engine.Scheduler;
import com.jobagents.matching.MatchingEngine;
import com.jobagents.matching.SkipList;
import com.jobagents.queue.WorkQueues;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Application entry point.
 *
 * <p>Modes:</p>
 * <ul>
 *   <li>{@code run} (default): schedule all agents until Ctrl+C</li>
 *   <li>{@code once <agent>}: run a single step of one agent and exit</li>
 *   <li>{@code reset-matcher <id>... [--dry-run]}: forget matcher results so they are scored again</li>
 * </ul>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final String FETCHER = "job_fetcher";
    static final String MATCHER = "job_matcher";
    static final String RESUME = "resume_agent";
    static final String COVER_LETTER = "cover_letter_agent";

    private static Database database;
    private static Scheduler scheduler;
    private static Thread schedulerThread;

    public static void main(String[] args) {
        installLogging();

        String mode = args.length == 0 ? "run" : args[0];
        try {
            PipelineConfig config = PipelineConfig.load();
            switch (mode) {
                case "run" -> runPipeline(config);
                case "once" -> {
                    if (args.length < 2) {
                        usage();
                        System.exit(2);
                    }
                    runOnce(config, args[1]);
                }
                case "reset-matcher" -> resetMatcher(config, Arrays.copyOfRange(args, 1, args.length));
                default -> {
                    usage();
                    System.exit(2);
                }
            }
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error in mode " + mode, e);
            System.exit(1);
        }
    }

    private static void runPipeline(PipelineConfig config) throws Exception {
        logger.info("=== Job Agents Starting ===");

        initializeDatabase(config);
        WorkQueues queues = new WorkQueues(config.getDataDirectory());
        Map<String, BaseAgent> agents = createAgents(config, queues, new PackageRepository(database));

        scheduler = createScheduler(config, agents, queues);
        schedulerThread = new Thread(() -> {
            try {
                scheduler.start();
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Scheduler error", e);
            }
        }, "Scheduler-Thread");
        schedulerThread.setDaemon(false);
        schedulerThread.start();

        addShutdownHook();
        logger.info("=== Job Agents running, queues: " + queues.sizes() + " ===");
        logger.info("Press Ctrl+C to stop");

        schedulerThread.join();
    }

    private static void runOnce(PipelineConfig config, String agentName) throws Exception {
        initializeDatabase(config);
        try {
            Map<String, BaseAgent> agents = createAgents(config, new WorkQueues(config.getDataDirectory()),
                    new PackageRepository(database));
            BaseAgent agent = agents.get(agentName);
            if (agent == null) {
                throw new IllegalArgumentException("Unknown agent '" + agentName + "', expected one of "
                        + agents.keySet());
            }
            StepOutcome outcome = agent.runOnce();
            logger.info("Agent " + agentName + " finished one step: " + outcome);
        } finally {
            database.close();
        }
    }

    private static void resetMatcher(PipelineConfig config, String[] args) {
        boolean dryRun = false;
        List<Long> ids = new ArrayList<>();
        for (String arg : args) {
            if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else {
                try {
                    ids.add(Long.parseLong(arg));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a candidate id: " + arg, e);
                }
            }
        }
        if (ids.isEmpty()) {
            logger.info("No candidate ids given, nothing to reset");
            return;
        }
        MatcherStateTool.pruneFile(config.agentConfig(MATCHER).getStatePath(), ids, dryRun);
    }

    /**
     * Build the four pipeline agents, in pipeline order.
     */
    static Map<String, BaseAgent> createAgents(PipelineConfig config, WorkQueues queues, PackageStore packages) {
        HttpJson http = new HttpJson(config.getConnectTimeoutMillis());
        BackendApiClient backend = new BackendApiClient(config.getBackendUrl(), http,
                config.getMatchTopK(), config.getGenerationTopK());
        TextDocumentWriter writer = new TextDocumentWriter(config.getOutputDirectory());

        AdzunaListingSource listings = new AdzunaListingSource(config.getAdzunaBaseUrl(), config.getAdzunaAppId(),
                config.getAdzunaApiKey(), config.getAdzunaWhat(), config.getAdzunaWhere(),
                config.getAdzunaMaxPages(), http);

        Map<String, BaseAgent> agents = new LinkedHashMap<>();
        agents.put(FETCHER, new JobFetcherAgent(config.agentConfig(FETCHER), listings, backend));
        agents.put(MATCHER, new MatchingEngine(config.agentConfig(MATCHER), backend, backend,
                queues.get(WorkQueues.RESUME_QUEUE), SkipList.parse(config.getSkipList()),
                config.getMatcherSettings()));
        agents.put(RESUME, new ResumeAgent(config.agentConfig(RESUME), queues.get(WorkQueues.RESUME_QUEUE),
                queues.get(WorkQueues.COVER_LETTER_QUEUE), backend, backend, writer, packages));
        agents.put(COVER_LETTER, new CoverLetterAgent(config.agentConfig(COVER_LETTER),
                queues.get(WorkQueues.COVER_LETTER_QUEUE), backend, backend, writer, packages));
        return agents;
    }

    /**
     * Register every agent with its interval and, where configured, a non-empty-queue gate.
     */
    static Scheduler createScheduler(PipelineConfig config, Map<String, BaseAgent> agents, WorkQueues queues) {
        Scheduler created = new Scheduler(config.getTickPeriod());
        for (Map.Entry<String, BaseAgent> entry : agents.entrySet()) {
            String readyQueue = config.getReadyQueue(entry.getKey());
            ReadinessCheck readiness = readyQueue == null
                    ? ReadinessCheck.always()
                    : ReadinessCheck.queueNotEmpty(queues.get(readyQueue));
            created.register(ScheduledTask.forAgent(entry.getValue(), config.getTaskInterval(entry.getKey()), readiness));
        }
        return created;
    }

    private static void initializeDatabase(PipelineConfig config) throws Exception {
        logger.info("Initializing database...");
        database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                config.getDbPoolSize());
        database.initialize();
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");

            if (scheduler != null) {
                try {
                    scheduler.shutdown();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error shutting down scheduler", e);
                }
            }
            if (schedulerThread != null) {
                schedulerThread.interrupt();
            }
            if (database != null) {
                database.close();
            }

            logger.info("=== Job Agents stopped ===");
        }, "Shutdown-Hook"));
    }

    // An explicit -Djava.util.logging.config.file wins over the bundled setup
    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load logging.properties", e);
        }
    }

    private static void usage() {
        System.err.println("Usage: job-agents [run | once <agent> | reset-matcher <id>... [--dry-run]]");
        System.err.println("Agents: " + FETCHER + ", " + MATCHER + ", " + RESUME + ", " + COVER_LETTER);
    }
}
