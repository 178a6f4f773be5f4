package io.github.flowdiff.analyzer.python;

import com.google.common.base.Splitter;
import io.github.flowdiff.analyzer.SymbolTable;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Python symbols plus the indices the call resolver needs: module-level imports per module and
 * the classes defined in the project.
 */
public final class PythonSymbolTable extends SymbolTable {
    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    /**
     * A class definition. {@code methods} maps method name to the method's qualified name;
     * {@code instanceAttributes} maps attributes assigned in {@code __init__} to their constructor name.
     */
    public record ClassInfo(String name,
                            String qualifiedName,
                            String module,
                            List<String> baseClasses,
                            Map<String, String> methods,
                            Map<String, String> instanceAttributes) {
        public ClassInfo {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
            Objects.requireNonNull(module, "module must not be null");
            baseClasses = List.copyOf(baseClasses);
            methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
            instanceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(instanceAttributes));
        }
    }

    private final Map<String, Map<String, String>> importsByModule = new LinkedHashMap<>();
    private final Map<String, ClassInfo> classesByQualifiedName = new LinkedHashMap<>();
    private final Map<String, ClassInfo> classesBySimpleName = new LinkedHashMap<>();

    public PythonSymbolTable() {
        super(PythonAnalyzer.LANGUAGE);
    }

    public void addImport(String module, String alias, String target) {
        importsByModule.computeIfAbsent(module, k -> new LinkedHashMap<>()).put(alias, target);
    }

    /** Module-level imports of {@code module}, alias to dotted target. */
    public Map<String, String> getImports(String module) {
        return Collections.unmodifiableMap(importsByModule.getOrDefault(module, Map.of()));
    }

    public void addClass(ClassInfo classInfo) {
        classesByQualifiedName.put(classInfo.qualifiedName(), classInfo);
        classesBySimpleName.put(classInfo.name(), classInfo);
    }

    public @Nullable ClassInfo getClassByQualifiedName(String qualifiedName) {
        return classesByQualifiedName.get(qualifiedName);
    }

    /**
     * Copies every symbol, import and class of {@code other} into this table. Later additions win.
     */
    void absorb(PythonSymbolTable other) {
        other.getAllSymbols().forEach(this::addSymbol);
        other.importsByModule.forEach((module, imports) -> imports.forEach((alias, target) -> addImport(module, alias, target)));
        other.classesByQualifiedName.values().forEach(this::addClass);
    }

    /**
     * Finds the class a type name refers to from inside {@code module}. Tried in order: a class of
     * that module, a function-local import, a module-level import, and a class with that simple name
     * anywhere in the project. Dotted names are resolved through the imports of their first segment.
     */
    public @Nullable ClassInfo resolveClass(String typeName, String module, Map<String, String> localImports) {
        var sameModule = classesByQualifiedName.get(module + "." + typeName);
        if (sameModule != null) {
            return sameModule;
        }

        var imported = localImports.get(typeName);
        if (imported == null) {
            imported = getImports(module).get(typeName);
        }
        if (imported != null && classesByQualifiedName.containsKey(imported)) {
            return classesByQualifiedName.get(imported);
        }

        if (typeName.contains(".")) {
            var exact = classesByQualifiedName.get(typeName);
            if (exact != null) {
                return exact;
            }
            var parts = DOT_SPLITTER.splitToList(typeName);
            for (int i = parts.size() - 1; i > 0; i--) {
                var prefix = String.join(".", parts.subList(0, i));
                var target = localImports.getOrDefault(prefix, getImports(module).get(prefix));
                if (target != null) {
                    var candidate = classesByQualifiedName.get(target + "." + String.join(".", parts.subList(i, parts.size())));
                    if (candidate != null) {
                        return candidate;
                    }
                }
            }
            return null;
        }

        return classesBySimpleName.get(typeName);
    }

    /**
     * Qualified name of {@code method} on {@code classInfo} or, failing that, on its base classes,
     * searched breadth first. Returns null if no known class in the hierarchy defines it.
     */
    public @Nullable String findMethod(ClassInfo classInfo, String method) {
        var queue = new ArrayDeque<ClassInfo>();
        var seen = new HashSet<String>();
        queue.add(classInfo);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (!seen.add(current.qualifiedName())) {
                continue;
            }
            var target = current.methods().get(method);
            if (target != null && contains(target)) {
                return target;
            }
            for (var base : current.baseClasses()) {
                var baseInfo = resolveClass(base, current.module(), Map.of());
                if (baseInfo != null) {
                    queue.add(baseInfo);
                }
            }
        }
        return null;
    }
}
