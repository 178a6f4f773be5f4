package io.github.flowdiff.analyzer.python;

import io.github.flowdiff.analyzer.Symbol;
import io.github.flowdiff.analyzer.SymbolTable;
import io.github.flowdiff.testutil.TestProjects;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PythonCallResolverTest {
    private static final Map<String, String> SERVICE_FILES = Map.of(
            "svc.py", """
                    class Service:
                        def __init__(self):
                            self.repo = Repo()

                        def run(self):
                            self.repo.save()
                            return helper()

                    class Repo:
                        def save(self):
                            pass

                    def helper():
                        s = Service()
                        s.run()
                    """);

    private final PythonAnalyzer analyzer = new PythonAnalyzer();

    @TempDir
    Path tempDir;

    /** Builds, merges and resolves the given files, keyed by relative path. */
    private SymbolTable resolve(Map<String, String> files) throws IOException {
        var tables = new ArrayList<SymbolTable>();
        for (var entry : files.entrySet()) {
            tables.add(analyzer.buildSymbolTable(TestProjects.write(tempDir, entry.getKey(), entry.getValue())));
        }
        var merged = analyzer.mergeSymbolTables(tables);
        analyzer.resolveCalls(merged);
        return merged;
    }

    private static List<String> calls(SymbolTable table, String qualifiedName) {
        Symbol symbol = table.getSymbol(qualifiedName);
        assertNotNull(symbol, "missing symbol " + qualifiedName);
        return symbol.getResolvedCalls();
    }

    @Test
    void testLocalBindingMethodCall() throws IOException {
        var table = resolve(Map.of("app.py", """
                class Foo:
                    def bar(self):
                        pass

                def f():
                    x = Foo()
                    x.bar()
                """));

        assertEquals(List.of("app.Foo", "app.Foo.bar"), calls(table, "app.f"));
    }

    @Test
    void testConstructorResolvesToInitWhenDefined() throws IOException {
        var table = resolve(Map.of("app.py", """
                class Foo:
                    def __init__(self):
                        pass

                def make():
                    return Foo()
                """));

        assertEquals(List.of("app.Foo.__init__"), calls(table, "app.make"));
    }

    @Test
    void testSelfCallsAndInheritance() throws IOException {
        var files = new LinkedHashMap<String, String>();
        files.put("store.py", """
                class Store:
                    def load(self, key):
                        return key
                """);
        files.put("svc.py", """
                from store import Store

                class Base:
                    def log(self):
                        pass

                class Service(Base):
                    def __init__(self):
                        self.store = Store()

                    def run(self):
                        self.log()
                        self.store.load("k")
                        self.finish()

                    def finish(self):
                        pass
                """);
        var table = resolve(files);

        assertEquals(List.of("svc.Base.log", "store.Store.load", "svc.Service.finish"),
                     calls(table, "svc.Service.run"));
        assertEquals(List.of("store.Store"), calls(table, "svc.Service.__init__"));
    }

    @Test
    void testImportsAndSameModule() throws IOException {
        var files = new LinkedHashMap<String, String>();
        files.put("pkg/__init__.py", "");
        files.put("pkg/util.py", """
                def helper():
                    pass

                def other():
                    pass
                """);
        files.put("main.py", """
                from pkg.util import helper
                import pkg.util as u
                import pkg

                def local():
                    pass

                def go():
                    helper()
                    u.other()
                    pkg.util.other()
                    local()
                    print("done")
                """);
        var table = resolve(files);

        assertEquals(List.of("pkg.util.helper", "pkg.util.other", "main.local"), calls(table, "main.go"));
    }

    @Test
    void testFunctionLocalImportWinsOverModuleImport() throws IOException {
        var files = new LinkedHashMap<String, String>();
        files.put("a.py", "def impl():\n    pass\n");
        files.put("b.py", "def impl():\n    pass\n");
        files.put("main.py", """
                from a import impl

                def go():
                    from b import impl
                    impl()

                def other():
                    impl()
                """);
        var table = resolve(files);

        assertEquals(List.of("b.impl"), calls(table, "main.go"));
        assertEquals(List.of("a.impl"), calls(table, "main.other"));
    }

    @Test
    void testUnresolvedCallsAreDroppedButKeptRaw() throws IOException {
        var table = resolve(Map.of("app.py", """
                def f(items):
                    json.dumps(items)
                    len(items)
                    items.append(1)
                """));

        Symbol f = table.getSymbol("app.f");
        assertTrue(f.getResolvedCalls().isEmpty());
        assertEquals(List.of("json.dumps", "len", "items.append"), f.getRawCalls());
    }

    @Test
    void testResolveIsIdempotent() throws IOException {
        var table = resolve(SERVICE_FILES);
        var first = new LinkedHashMap<String, List<String>>();
        table.getAllSymbols().forEach(s -> first.put(s.getQualifiedName(), s.getResolvedCalls()));

        analyzer.resolveCalls(table);
        table.getAllSymbols().forEach(s -> assertEquals(first.get(s.getQualifiedName()), s.getResolvedCalls(),
                                                        "resolved calls changed for " + s.getQualifiedName()));
    }

    @Test
    void testDuplicateCallsResolveOnce() throws IOException {
        var table = resolve(Map.of("app.py", """
                def helper():
                    pass

                def f():
                    helper()
                    helper()
                """));

        assertEquals(List.of("helper", "helper"), table.getSymbol("app.f").getRawCalls());
        assertEquals(List.of("app.helper"), calls(table, "app.f"));
    }
}
