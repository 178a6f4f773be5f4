package io.github.flowdiff.testutil;

import io.github.flowdiff.analyzer.ProjectFile;
import io.github.flowdiff.analyzer.PythonMetadata;
import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.analyzer.python.PythonAnalyzer;
import org.eclipse.jgit.api.Git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Fixture projects and small builders shared by the tests.
 */
public final class TestProjects {
    private static final Path SYNTHETIC_ROOT = Path.of("/synthetic").toAbsolutePath().normalize();

    private TestProjects() {
    }

    /** A project directory under src/test/resources/{subDir}. */
    public static Path fixture(String subDir) {
        Path testDir = Path.of("src/test/resources", subDir);
        assertTrue(Files.exists(testDir), "Test resource dir missing: " + testDir);
        assertTrue(Files.isDirectory(testDir), testDir + " is not a directory");
        return testDir.toAbsolutePath().normalize();
    }

    public static ProjectFile write(Path root, String relPath, String content) throws IOException {
        var target = root.resolve(relPath);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content);
        return new ProjectFile(root.toAbsolutePath().normalize(), Path.of(relPath));
    }

    /** Copies every file of a fixture project below {@code target}. */
    public static void copyFixture(String subDir, Path target) throws IOException {
        var source = fixture(subDir);
        try (var paths = Files.walk(source)) {
            for (var path : paths.filter(Files::isRegularFile).toList()) {
                var dest = target.resolve(source.relativize(path).toString());
                Files.createDirectories(dest.getParent());
                Files.copy(path, dest);
            }
        }
    }

    /** A Python function symbol in module {@code a} of a project that does not exist on disk. */
    public static Symbol pythonSymbol(String qualifiedName, String... calls) {
        var name = qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
        var module = qualifiedName.contains(".") ? qualifiedName.substring(0, qualifiedName.lastIndexOf('.')) : "a";
        var metadata = new PythonMetadata(module, null, List.of(), null, false, false, List.of(),
                                          Map.of(), Map.of(), null, null, false, false, false);
        var symbol = new Symbol(name, qualifiedName, PythonAnalyzer.LANGUAGE,
                                new ProjectFile(SYNTHETIC_ROOT, module.replace('.', '/') + ".py"),
                                1, metadata, List.of(calls), null);
        symbol.addResolvedCalls(List.of(calls));
        return symbol;
    }

    public static Git initRepo(Path dir) throws Exception {
        Files.createDirectories(dir);
        return Git.init().setDirectory(dir.toFile()).call();
    }

    public static String commitAll(Git git, String message) throws Exception {
        git.add().addFilepattern(".").call();
        git.add().addFilepattern(".").setUpdate(true).call();
        return git.commit()
                .setMessage(message)
                .setAuthor("Test User", "test@example.com")
                .setCommitter("Test User", "test@example.com")
                .setSign(false)
                .call()
                .getName();
    }
}
