package uisnap.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import uisnap.diff.DiffEngine;
import uisnap.diff.DiffStrategy;
import uisnap.model.Snapshot;
import uisnap.model.SnapshotIO;
import uisnap.model.TraversalDiff;
import uisnap.provider.RecordedNode;
import uisnap.provider.RecordedTreeProvider;
import uisnap.provider.TreeDumpIO;
import uisnap.traversal.SnapshotConfig;
import uisnap.traversal.TreeTraverser;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line entry-point for uisnap.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code uisnap traverse} - capture a snapshot from a recorded tree dump</li>
 *   <li>{@code uisnap diff}     - compare two saved snapshots</li>
 *   <li>{@code uisnap version}  - print build version</li>
 * </ul>
 *
 * <p>Results go to standard output as JSON unless {@code --output} is given. Logging goes
 * to standard error.
 */
@Command(
        name        = "uisnap",
        description = "Capture, filter and diff snapshots of UI element trees",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                UiSnapCLI.TraverseCommand.class,
                UiSnapCLI.DiffCommand.class,
                UiSnapCLI.VersionCommand.class
        }
)
public class UiSnapCLI implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        spec.commandLine().usage(out);
        out.flush();
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new UiSnapCLI()).execute(args);
        System.exit(exit);
    }

    static void emit(CommandSpec spec, String text) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(text);
        out.flush();
    }

    static int fail(CommandSpec spec, String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println(message);
        err.flush();
        return 1;
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Replays a recorded tree dump through the traverser and prints the snapshot.
     */
    @Command(
            name        = "traverse",
            description = "Capture a snapshot from a recorded element tree (JSON tree dump)",
            mixinStandardHelpOptions = true
    )
    static class TraverseCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(TraverseCommand.class);

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to tree dump JSON file")
        Path treeFile;

        @Option(names = {"--visible-only"}, description = "Collect only elements with a position and a non-zero size")
        boolean visibleOnly;

        @Option(names = {"-l", "--label"}, description = "Snapshot label (default: root node id)")
        String label;

        @Option(names = {"-o", "--output"}, description = "Write the snapshot to this file instead of stdout")
        Path output;

        @Override
        public Integer call() {
            if (!Files.exists(treeFile)) {
                return fail(spec, "Tree dump not found: " + treeFile.toAbsolutePath());
            }
            try {
                SnapshotConfig config = new SnapshotConfig();
                RecordedNode root = TreeDumpIO.read(treeFile);
                TreeTraverser<RecordedNode> traverser =
                        new TreeTraverser<>(RecordedTreeProvider.INSTANCE, config);

                boolean onlyVisible = visibleOnly || config.isOnlyVisible();
                Snapshot snapshot = traverser.traverse(root,
                        label != null ? label : root.getId(), onlyVisible);

                if (output != null) {
                    SnapshotIO.writeSnapshot(snapshot, output);
                } else {
                    emit(spec, SnapshotIO.toJson(snapshot));
                }
                log.info("Captured {} elements ({} excluded)", snapshot.size(),
                        snapshot.getStats().getExcludedCount());
                return 0;
            } catch (IOException | RuntimeException e) {
                log.error("Traversal failed: {}", e.getMessage(), e);
                return fail(spec, "Traversal failed: " + e.getMessage());
            }
        }
    }

    /**
     * Loads two snapshots and prints what was added, removed or modified between them.
     */
    @Command(
            name        = "diff",
            description = "Compare two saved snapshots",
            mixinStandardHelpOptions = true
    )
    static class DiffCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Snapshot taken before the change")
        Path beforeFile;

        @Parameters(index = "1", description = "Snapshot taken after the change")
        Path afterFile;

        @Option(names = {"--fine"}, description = "Pair elements by role and position and report attribute changes")
        boolean fine;

        @Option(names = {"-t", "--tolerance"},
                description = "Maximum pairing distance in points for --fine (default: diff.position.tolerance)")
        Double tolerance;

        @Option(names = {"--summary"}, description = "Print a human-readable summary instead of JSON")
        boolean summary;

        @Option(names = {"-o", "--output"}, description = "Write the diff to this file instead of stdout")
        Path output;

        @Override
        public Integer call() {
            for (Path p : new Path[] {beforeFile, afterFile}) {
                if (!Files.exists(p)) {
                    return fail(spec, "Snapshot not found: " + p.toAbsolutePath());
                }
            }
            try {
                SnapshotConfig config = new SnapshotConfig();
                Snapshot before = SnapshotIO.readSnapshot(beforeFile);
                Snapshot after  = SnapshotIO.readSnapshot(afterFile);

                DiffStrategy strategy = fine ? DiffStrategy.FINE : DiffStrategy.fromName(config.getDiffStrategy());
                double positionTolerance = tolerance != null ? tolerance : config.getPositionTolerance();

                TraversalDiff diff = new DiffEngine(config.getAttributeTolerance())
                        .diff(before, after, strategy, positionTolerance);
                log.info("{} diff: added={}, removed={}, modified={}", strategy.label(),
                        diff.getAdded().size(), diff.getRemoved().size(), diff.getModified().size());

                if (output != null) {
                    SnapshotIO.writeDiff(diff, output);
                } else {
                    emit(spec, summary ? diff.summary() : SnapshotIO.toJson(diff));
                }
                return 0;
            } catch (IOException | RuntimeException e) {
                log.error("Diff failed: {}", e.getMessage(), e);
                return fail(spec, "Diff failed: " + e.getMessage());
            }
        }
    }

    @Command(name = "version", description = "Print version information")
    static class VersionCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.println("uisnap 1.0.0-SNAPSHOT");
            out.println("Snapshot schema " + Snapshot.CURRENT_SCHEMA_VERSION);
            out.flush();
            return 0;
        }
    }
}
