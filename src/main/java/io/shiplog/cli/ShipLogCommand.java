package io.shiplog.cli;

import io.shiplog.config.ConfigLoader;
import io.shiplog.config.ConfigValidationException;
import io.shiplog.config.ShipLogConfig;
import io.shiplog.config.WatchRule;
import io.shiplog.deletion.DeletionDecision;
import io.shiplog.deletion.SweepResult;
import io.shiplog.model.QueueEntry;
import io.shiplog.remote.ObjectStoreFactory;
import io.shiplog.runtime.ShipLogRuntime;
import io.shiplog.storage.StateCorruptedException;
import io.shiplog.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "shiplog",
        mixinStandardHelpOptions = true,
        description = "Vehicle log shipping daemon",
        subcommands = {
                ShipLogCommand.RunCommand.class,
                ShipLogCommand.CheckConfigCommand.class,
                ShipLogCommand.StatusCommand.class,
                ShipLogCommand.QueueCommand.class,
                ShipLogCommand.QueueRetryCommand.class,
                ShipLogCommand.CleanupCommand.class,
                ShipLogCommand.DeletionCheckCommand.class,
                ShipLogCommand.RegistryPruneCommand.class,
                ShipLogCommand.AuditVerifyCommand.class
        }
)
public final class ShipLogCommand implements Runnable {
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_STATE_ERROR = 3;

    @Option(names = {"-c", "--config"}, description = "Path to the YAML configuration file", defaultValue = "/etc/shiplog/config.yaml")
    String configPath;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | check-config | status | queue | queue-retry | cleanup | deletion-check | registry-prune | audit-verify");
    }

    ShipLogConfig config() {
        return new ConfigLoader().load(Paths.get(configPath));
    }

    ShipLogRuntime runtime() {
        return ShipLogRuntime.create(config());
    }

    static Integer guarded(Callable<Integer> action) throws Exception {
        try {
            return action.call();
        } catch (ConfigValidationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (StateCorruptedException e) {
            System.err.println("State error: " + e.getMessage()
                    + (e.getCause() == null ? "" : " (" + e.getCause().getMessage() + ")"));
            return EXIT_STATE_ERROR;
        }
    }

    @Command(name = "run", description = "Run the daemon until SIGTERM/SIGINT")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Option(names = {"--grace-seconds"}, defaultValue = "30", description = "Time in-flight uploads get to finish on shutdown")
        long graceSeconds;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                ShipLogRuntime runtime = parent.runtime();
                runtime.start();
                CountDownLatch stopped = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    try {
                        runtime.stop(Duration.ofSeconds(graceSeconds));
                    } finally {
                        stopped.countDown();
                    }
                }, "shiplog-shutdown-hook"));
                stopped.await();
                return 0;
            });
        }
    }

    @Command(name = "check-config", description = "Validate the configuration file and print the effective settings")
    static final class CheckConfigCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                ShipLogConfig config = parent.config();
                ObjectStoreFactory.create(config.remote(), config.upload().transfer().requestTimeout()).close();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("valid", true);
                out.put("vehicle_id", config.vehicleId());
                List<Map<String, Object>> dirs = new ArrayList<>();
                for (WatchRule rule : config.watchRules()) {
                    Map<String, Object> dir = new LinkedHashMap<>();
                    dir.put("path", rule.rootPath().toString());
                    dir.put("source", rule.sourceLabel());
                    dir.put("pattern", rule.globPattern());
                    dir.put("recursive", rule.recursive());
                    dir.put("allow_deletion", rule.allowDeletion());
                    dirs.add(dir);
                }
                out.put("log_directories", dirs);
                out.put("schedule", config.drainSchedule().describe());
                out.put("operational_hours", config.operationalHours().enabled()
                        ? config.operationalHours().start() + "-" + config.operationalHours().end()
                        : "always");
                out.put("queue_file", config.upload().queueFile().toString());
                out.put("registry_file", config.upload().registryFile().toString());
                out.put("time_zone", config.zone().getId());
                System.out.println(Jsons.toJson(out));
                return 0;
            });
        }
    }

    @Command(name = "status", description = "Show queue, registry and disk status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    System.out.println(Jsons.toJson(runtime.status()));
                }
                return 0;
            });
        }
    }

    @Command(name = "queue", description = "List queue entries")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Option(names = {"--failed"}, defaultValue = "false", description = "Only permanently failed entries")
        boolean failedOnly;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    List<QueueEntry> entries = runtime.queueEntries(failedOnly);
                    System.out.println(Jsons.toJson(entries));
                }
                return 0;
            });
        }
    }

    @Command(name = "queue-retry", description = "Reset permanently failed entries to pending (run while the daemon is stopped)")
    static final class QueueRetryCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    System.out.println(Jsons.toJson(Map.of("requeued", runtime.retryFailed())));
                }
                return 0;
            });
        }
    }

    @Command(name = "cleanup", description = "Run one deletion policy now")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Option(names = {"--policy"}, required = true, description = "deferred|age|emergency")
        String policy;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report what would be deleted without deleting")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                SweepResult result;
                try (ShipLogRuntime runtime = parent.runtime()) {
                    result = runtime.cleanup(policy, dryRun);
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    return 1;
                }
                System.out.println(Jsons.toJson(result));
                return 0;
            });
        }
    }

    @Command(name = "deletion-check", description = "Explain whether the deletion gates allow removing a file")
    static final class DeletionCheckCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Parameters(index = "0", description = "File path")
        String file;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    DeletionDecision decision = runtime.evaluateDeletion(Path.of(file));
                    System.out.println(Jsons.toJson(decision));
                    return decision.allowed() ? 0 : 1;
                }
            });
        }
    }

    @Command(name = "registry-prune", description = "Remove expired registry records not referenced by the queue")
    static final class RegistryPruneCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    System.out.println(Jsons.toJson(Map.of("removed", runtime.pruneRegistry())));
                }
                return 0;
            });
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ShipLogCommand parent;

        @Override
        public Integer call() throws Exception {
            return guarded(() -> {
                try (ShipLogRuntime runtime = parent.runtime()) {
                    int rows = runtime.audit().verify();
                    System.out.println(Jsons.toJson(Map.of("valid", true, "rows", rows)));
                    return 0;
                } catch (IllegalStateException e) {
                    System.out.println(Jsons.toJson(Map.of("valid", false, "error", e.getMessage())));
                    return 1;
                }
            });
        }
    }
}
