package io.github.flowdiff.analyzer.bridge;

import io.github.flowdiff.analyzer.LanguageBridge;
import io.github.flowdiff.analyzer.ShellMetadata;
import io.github.flowdiff.analyzer.SymbolTable;
import io.github.flowdiff.analyzer.python.PythonAnalyzer;
import io.github.flowdiff.analyzer.shell.ShellAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links {@code python -m pkg.tool} and {@code python pkg/tool.py} in shell scripts to the module's
 * {@code main} function, or to its script entry when the module has no {@code main}.
 */
public final class PythonInvocationBridge implements LanguageBridge {
    private static final Logger logger = LogManager.getLogger(PythonInvocationBridge.class);

    @Override
    public boolean canBridge(String fromLanguage, String toLanguage) {
        return ShellAnalyzer.LANGUAGE.equals(fromLanguage) && PythonAnalyzer.LANGUAGE.equals(toLanguage);
    }

    @Override
    public Map<String, List<String>> resolve(Map<String, SymbolTable> tables) {
        var python = tables.get(PythonAnalyzer.LANGUAGE);
        var shell = tables.get(ShellAnalyzer.LANGUAGE);
        if (python == null || shell == null) {
            return Map.of();
        }

        var result = new LinkedHashMap<String, List<String>>();
        for (var script : shell.getAllSymbols()) {
            var targets = new ArrayList<String>();
            for (var rawCall : script.getRawCalls()) {
                if (!rawCall.startsWith(ShellMetadata.PYTHON_CALL_PREFIX)) {
                    continue;
                }
                var module = toModule(rawCall.substring(ShellMetadata.PYTHON_CALL_PREFIX.length()));
                var target = moduleEntry(python, module);
                if (target != null) {
                    targets.add(target);
                } else {
                    logger.trace("No entry found for Python module {} invoked by {}", module, script.getQualifiedName());
                }
            }
            if (!targets.isEmpty()) {
                result.put(script.getQualifiedName(), targets);
            }
        }
        return result;
    }

    /** {@code ./pkg/tool.py} becomes {@code pkg.tool}; module names pass through. */
    static String toModule(String invocation) {
        if (!invocation.endsWith(".py")) {
            return invocation;
        }
        var path = invocation.substring(0, invocation.length() - 3);
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        if (path.endsWith("/__main__")) {
            path = path.substring(0, path.length() - "/__main__".length());
        }
        return path.replace('/', '.');
    }

    private static @Nullable String moduleEntry(SymbolTable python, String module) {
        var main = module + ".main";
        if (python.contains(main)) {
            return main;
        }
        for (var symbol : python.getAllSymbols()) {
            var metadata = symbol.pythonMetadata();
            if (metadata != null && metadata.scriptEntry() && metadata.module().equals(module)) {
                return symbol.getQualifiedName();
            }
        }
        return null;
    }
}
