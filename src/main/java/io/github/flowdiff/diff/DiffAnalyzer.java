package io.github.flowdiff.diff;

import io.github.flowdiff.FlowDiffConfig;
import io.github.flowdiff.analyzer.AnalysisOrchestrator;
import io.github.flowdiff.analyzer.EntryPointFilter;
import io.github.flowdiff.analyzer.LanguageRegistry;
import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.analyzer.SymbolTable;
import io.github.flowdiff.git.GitArchiveMaterializer;
import io.github.flowdiff.git.GitRepo;
import io.github.flowdiff.git.JGitTreeMaterializer;
import io.github.flowdiff.git.TreeMaterializer;
import io.github.flowdiff.tree.CallTreeBuilder;
import io.github.flowdiff.tree.CallTreeNode;
import io.github.flowdiff.util.FileUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the call structure of a project at two git references.
 * <p>
 * Each committed side is extracted into its own temporary directory, analyzed there, and the
 * directory removed afterwards; the working-tree side is analyzed in place. Symbols that changed
 * are flagged on each side before the call trees are built, so the trees open up far enough to
 * show every change.
 */
public final class DiffAnalyzer {
    private static final Logger logger = LogManager.getLogger(DiffAnalyzer.class);

    private final Path projectRoot;
    private final FlowDiffConfig config;
    private final LanguageRegistry registry;
    private final TreeMaterializer materializer;
    private final @Nullable EntryPointFilter entryPointFilter;

    public DiffAnalyzer(Path projectRoot, FlowDiffConfig config) {
        this(projectRoot, config, AnalysisOrchestrator.defaultRegistry(), materializerFor(config), null);
    }

    public DiffAnalyzer(Path projectRoot,
                        FlowDiffConfig config,
                        LanguageRegistry registry,
                        TreeMaterializer materializer,
                        @Nullable EntryPointFilter entryPointFilter) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.config = config;
        this.registry = registry;
        this.materializer = materializer;
        this.entryPointFilter = entryPointFilter;
    }

    /**
     * The materializer named by {@code flowdiff.git.materializer}: {@code archive} for the git and
     * tar command-line tools, anything else for JGit.
     */
    public static TreeMaterializer materializerFor(FlowDiffConfig config) {
        if ("archive".equals(config.getMaterializer())) {
            return new GitArchiveMaterializer(config.getArchiveTimeoutSeconds());
        }
        return new JGitTreeMaterializer();
    }

    /**
     * @throws GitRepo.NoRepositoryException       if the project is not inside a git working tree
     * @throws GitRepo.InvalidReferenceException   if either reference does not resolve
     * @throws TreeMaterializer.MaterializationException if a commit cannot be extracted
     */
    public DiffResult analyzeDiff(String beforeRef, String afterRef) throws GitAPIException {
        try (var repo = new GitRepo(projectRoot, config.getWorkingTreeRef(), config.getExcludedDirectories(),
                                     config.isExcludeHiddenDirectories())) {
            var beforeSha = repo.resolveRef(beforeRef);
            var afterSha = repo.resolveRef(afterRef);
            var beforeDescription = repo.describeRef(beforeRef);
            var afterDescription = repo.describeRef(afterRef);
            logger.debug("Diffing {} against {}", beforeDescription, afterDescription);

            var fileChanges = repo.listFileChanges(beforeSha.orElse(null), afterSha.orElse(null),
                                                   registry.getFileExtensions());

            var beforeTables = analyzeAt(repo, beforeRef, beforeSha);
            var afterTables = analyzeAt(repo, afterRef, afterSha);
            var beforeUniverse = AnalysisOrchestrator.flatten(beforeTables);
            var afterUniverse = AnalysisOrchestrator.flatten(afterTables);

            var symbolChanges = SymbolDiffer.diff(beforeUniverse, afterUniverse);
            stampChanges(symbolChanges, beforeUniverse, afterUniverse);

            var builder = new CallTreeBuilder(config.getDefaultExpansionDepth());
            List<CallTreeNode> beforeTrees = builder.build(AnalysisOrchestrator.getEntryPoints(beforeTables), beforeUniverse);
            List<CallTreeNode> afterTrees = builder.build(AnalysisOrchestrator.getEntryPoints(afterTables), afterUniverse);

            int added = count(symbolChanges, ChangeKind.ADDED);
            int modified = count(symbolChanges, ChangeKind.MODIFIED);
            int deleted = count(symbolChanges, ChangeKind.DELETED);
            logger.info("{} -> {}: {} files changed, {} symbols added, {} modified, {} deleted",
                        beforeRef, afterRef, fileChanges.size(), added, modified, deleted);

            return new DiffResult(beforeRef, afterRef, beforeDescription, afterDescription, fileChanges,
                                  symbolChanges, beforeTrees, afterTrees, added, modified, deleted);
        }
    }

    /**
     * Runs the full analysis on the working tree, or on a private extraction of the commit.
     */
    private Map<String, SymbolTable> analyzeAt(GitRepo repo, String ref, Optional<String> sha) throws GitAPIException {
        if (sha.isEmpty()) {
            return newOrchestrator(projectRoot).analyze();
        }

        var commit = sha.get();
        Path checkout;
        try {
            checkout = Files.createTempDirectory("flowdiff-");
        } catch (IOException e) {
            throw new TreeMaterializer.MaterializationException("Unable to create a directory for %s (%s)".formatted(ref, commit),
                                                                ref, commit, e);
        }
        try {
            try {
                materializer.materialize(repo, commit, checkout);
            } catch (TreeMaterializer.MaterializationException e) {
                throw new TreeMaterializer.MaterializationException("Unable to materialize %s (%s): %s".formatted(ref, commit, e.getMessage()),
                                                                    ref, commit, e);
            }
            var prefix = repo.getProjectPrefix();
            var analysisRoot = prefix.isEmpty() ? checkout : checkout.resolve(prefix);
            if (!Files.isDirectory(analysisRoot)) {
                logger.debug("{} does not exist at {}; that side is empty", prefix, commit);
                Files.createDirectories(analysisRoot);
            }
            return newOrchestrator(analysisRoot).analyze();
        } catch (IOException e) {
            throw new TreeMaterializer.MaterializationException("Unable to prepare checkout of %s (%s)".formatted(ref, commit),
                                                                ref, commit, e);
        } finally {
            try {
                FileUtil.deleteRecursively(checkout);
            } catch (IOException e) {
                logger.warn("Unable to delete temporary checkout {}: {}", checkout, e.getMessage());
            }
        }
    }

    private AnalysisOrchestrator newOrchestrator(Path root) {
        return new AnalysisOrchestrator(root, config, registry, entryPointFilter);
    }

    /**
     * Flags each side's symbols that take part in a change visible on that side.
     */
    static void stampChanges(Map<String, SymbolChange> changes, Map<String, Symbol> before, Map<String, Symbol> after) {
        for (var change : changes.values()) {
            var name = change.qualifiedName();
            if (change.kind() != ChangeKind.ADDED && before.containsKey(name)) {
                before.get(name).setHasChanges(true);
            }
            if (change.kind() != ChangeKind.DELETED && after.containsKey(name)) {
                after.get(name).setHasChanges(true);
            }
        }
    }

    private static int count(Map<String, SymbolChange> changes, ChangeKind kind) {
        return (int) changes.values().stream().filter(c -> c.kind() == kind).count();
    }
}
