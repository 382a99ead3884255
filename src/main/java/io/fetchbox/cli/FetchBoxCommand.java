package io.fetchbox.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.fetchbox.broker.TaskBroker;
import io.fetchbox.config.FetchBoxConfig;
import io.fetchbox.model.DeadLetterEntry;
import io.fetchbox.model.Task;
import io.fetchbox.runtime.FetchBoxRuntime;
import io.fetchbox.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "fetchbox",
        mixinStandardHelpOptions = true,
        description = "FetchBox download queue CLI",
        subcommands = {
                FetchBoxCommand.InitCommand.class,
                FetchBoxCommand.EnqueueCommand.class,
                FetchBoxCommand.RunCommand.class,
                FetchBoxCommand.StatsCommand.class,
                FetchBoxCommand.EntriesCommand.class,
                FetchBoxCommand.DeadLettersCommand.class,
                FetchBoxCommand.DeadLetterCommand.class,
                FetchBoxCommand.ReplayCommand.class,
                FetchBoxCommand.ReplayAllCommand.class,
                FetchBoxCommand.PruneCommand.class,
                FetchBoxCommand.ReloadSettingsCommand.class,
                FetchBoxCommand.ResolveProxyCommand.class
        }
)
public final class FetchBoxCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | run | stats | entries | dead-letters | dead-letter | replay | replay-all | prune | reload-settings | resolve-proxy");
    }

    FetchBoxRuntime runtime() {
        FetchBoxRuntime runtime = new FetchBoxRuntime(FetchBoxConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Override
        public Integer call() {
            FetchBoxRuntime runtime = parent.runtime();
            System.out.println("Initialized FetchBox at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Enqueue tasks from a JSON file or a single URL")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Option(names = {"--file"}, description = "JSON file holding one task or an array of tasks")
        String file;

        @Option(names = {"--url"}, description = "Source URL for a single task")
        String url;

        @Option(names = {"--job-id"}, description = "Job id for a single task")
        String jobId;

        @Option(names = {"--resource-id"}, description = "Resource id for a single task")
        String resourceId;

        @Option(names = {"--job-type"}, description = "Job type, selects the handler settings")
        String jobType;

        @Option(names = {"--proxy"}, description = "Proxy pool name")
        String proxy;

        @Override
        public Integer call() throws Exception {
            List<Task> tasks = new ArrayList<>();
            if (file != null && !file.isBlank()) {
                JsonNode root = Jsons.mapper().readTree(Path.of(file).toFile());
                if (root.isArray()) {
                    for (JsonNode node : root) {
                        tasks.add(Jsons.mapper().treeToValue(node, Task.class));
                    }
                } else {
                    tasks.add(Jsons.mapper().treeToValue(root, Task.class));
                }
            } else if (url != null && jobId != null && resourceId != null) {
                Task task = Task.of(resourceId, jobId, url);
                if (jobType != null) {
                    task = task.withJobType(jobType);
                }
                if (proxy != null) {
                    task = task.withProxyHint(proxy);
                }
                tasks.add(task);
            } else {
                System.err.println("Provide --file, or --url with --job-id and --resource-id");
                return 2;
            }
            FetchBoxRuntime.BatchEnqueueOutcome outcome = parent.runtime().enqueueAll(tasks);
            System.out.println(Jsons.toJson(outcome));
            return outcome.queueFull() ? 1 : 0;
        }
    }

    @Command(name = "run", description = "Run the broker and workers until stopped, or drain visible tasks once")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Process currently visible tasks and exit")
        boolean once;

        @Option(names = {"--max"}, defaultValue = "1000", description = "Maximum tasks to process with --once")
        int max;

        @Option(names = {"--interval-ms"}, defaultValue = "1000", description = "Maintenance loop interval in ms")
        long intervalMs;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading fetchbox-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            FetchBoxRuntime runtime = parent.runtime();
            if (once) {
                FetchBoxRuntime.RunOnceOutcome outcome = runtime.runOnce(max);
                System.out.println(Jsons.toJson(Map.of(
                        "recoveredLeases", outcome.recoveredLeases(),
                        "processed", outcome.processed(),
                        "byDisposition", outcome.byDisposition()
                )));
                return 0;
            }
            TaskBroker broker = runtime.newBroker();
            long grace = runtime.settings().shutdownGraceMs();
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                TaskBroker.ShutdownOutcome out = broker.shutdown(grace);
                System.out.println(Jsons.toJson(out));
            }, "fetchbox-shutdown-hook"));
            broker.start();
            while (running.get()) {
                FetchBoxRuntime.MaintenanceOutcome maintenance = runtime.runMaintenance(settingsReloadMs);
                if (maintenance.settingsChanged() || maintenance.prune() != null) {
                    System.out.println(Jsons.toJson(maintenance));
                }
                Thread.sleep(Math.max(10L, intervalMs));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Queue counts by status and dead-letter total")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats()));
            return 0;
        }
    }

    @Command(name = "entries", description = "List queue entries")
    static final class EntriesCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Option(names = {"--status"}, description = "PENDING|LEASED|COMPLETED|DEAD_LETTERED")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Maximum entries")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().entries(status, limit)));
            return 0;
        }
    }

    @Command(name = "dead-letters", description = "List dead letters in sequence order")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Option(names = {"--after"}, defaultValue = "-1", description = "Start after this sequence")
        long after;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Maximum entries")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().deadLetters(after, limit)));
            return 0;
        }
    }

    @Command(name = "dead-letter", description = "Show one dead letter")
    static final class DeadLetterCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Parameters(index = "0", description = "Queue sequence")
        long sequence;

        @Override
        public Integer call() {
            Optional<DeadLetterEntry> entry = parent.runtime().deadLetter(sequence);
            if (entry.isEmpty()) {
                System.out.println("Dead letter not found: " + sequence);
                return 1;
            }
            System.out.println(Jsons.toJson(entry.get()));
            return 0;
        }
    }

    @Command(name = "replay", description = "Enqueue a dead-lettered task again")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Parameters(index = "0", description = "Dead-letter sequence")
        long sequence;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().replay(sequence)));
            return 0;
        }
    }

    @Command(name = "replay-all", description = "Replay dead letters that were never replayed")
    static final class ReplayAllCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum dead letters to replay")
        int limit;

        @Override
        public Integer call() {
            FetchBoxRuntime runtime = parent.runtime();
            var outcome = runtime.replayAll(limit);
            System.out.println(Jsons.toJson(outcome));
            return outcome.stoppedOnQueueFull() ? 1 : 0;
        }
    }

    @Command(name = "prune", description = "Delete finished queue entries and ledger files past retention")
    static final class PruneCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().prune()));
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload fetchbox-settings.json and print the outcome")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Override
        public Integer call() {
            FetchBoxRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.reloadSettings()));
            System.out.println(Jsons.toJson(runtime.settings()));
            return 0;
        }
    }

    @Command(name = "resolve-proxy", description = "Show the fallback tiers for a proxy pool")
    static final class ResolveProxyCommand implements Callable<Integer> {
        @ParentCommand
        FetchBoxCommand parent;

        @Parameters(index = "0", description = "Pool name")
        String pool;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().resolveProxy(pool)));
            return 0;
        }
    }
}
