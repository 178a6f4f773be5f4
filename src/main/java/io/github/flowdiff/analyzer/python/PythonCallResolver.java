package io.github.flowdiff.analyzer.python;

import com.google.common.base.Splitter;
import io.github.flowdiff.analyzer.PythonMetadata;
import io.github.flowdiff.analyzer.Symbol;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Maps the textual callees recorded during extraction to qualified names of known symbols.
 * <p>
 * Strategies are tried in a fixed order and the first hit wins:
 * <ol>
 *   <li>attribute chains through an inferred receiver type ({@code x.m} with {@code x = Cls()},
 *       {@code self.attr.m} with {@code self.attr} assigned in {@code __init__}, {@code self.m})</li>
 *   <li>imports written inside the calling function</li>
 *   <li>constructor calls of known classes</li>
 *   <li>module-level imports</li>
 *   <li>functions of the caller's own module</li>
 *   <li>dotted callees whose prefix is an imported name</li>
 * </ol>
 * Calls that match none of these (builtins, libraries, dynamic dispatch) stay unresolved.
 */
public final class PythonCallResolver {
    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    private final PythonSymbolTable table;

    public PythonCallResolver(PythonSymbolTable table) {
        this.table = table;
    }

    /**
     * Resolved targets of every raw call of {@code caller}, without duplicates, in call order.
     */
    public List<String> resolveAll(Symbol caller) {
        var metadata = caller.pythonMetadata();
        if (metadata == null) {
            return List.of();
        }
        var resolved = new LinkedHashSet<String>();
        for (var callee : caller.getRawCalls()) {
            var target = resolve(callee, metadata);
            if (target != null) {
                resolved.add(target);
            }
        }
        return List.copyOf(resolved);
    }

    public @Nullable String resolve(String callee, PythonMetadata caller) {
        var target = resolveAttributeChain(callee, caller);
        if (target != null) {
            return target;
        }
        target = resolveImport(callee, caller.functionLocalImports());
        if (target != null) {
            return target;
        }
        target = resolveConstructor(callee, caller);
        if (target != null) {
            return target;
        }
        target = resolveImport(callee, table.getImports(caller.module()));
        if (target != null) {
            return target;
        }
        var sameModule = caller.module() + "." + callee;
        if (table.contains(sameModule)) {
            return sameModule;
        }
        return resolveByPrefix(callee, caller);
    }

    private @Nullable String resolveAttributeChain(String callee, PythonMetadata caller) {
        if (!callee.contains(".")) {
            return null;
        }
        var parts = DOT_SPLITTER.splitToList(callee);
        var receiver = parts.get(0);
        var ownClass = enclosingClass(caller);

        if (parts.size() == 2) {
            var boundType = caller.localBindings().get(receiver);
            if (boundType != null) {
                var cls = table.resolveClass(boundType, caller.module(), caller.functionLocalImports());
                if (cls != null) {
                    var method = table.findMethod(cls, parts.get(1));
                    if (method != null) {
                        return method;
                    }
                }
            }
            if (ownClass != null && (receiver.equals("self") || receiver.equals("cls"))) {
                return table.findMethod(ownClass, parts.get(1));
            }
        }

        if (parts.size() == 3 && receiver.equals("self") && ownClass != null) {
            var attrType = ownClass.instanceAttributes().get(parts.get(1));
            if (attrType != null) {
                var cls = table.resolveClass(attrType, ownClass.module(), Map.of());
                if (cls != null) {
                    return table.findMethod(cls, parts.get(2));
                }
            }
        }
        return null;
    }

    private @Nullable PythonSymbolTable.ClassInfo enclosingClass(PythonMetadata caller) {
        return caller.className() == null
               ? null
               : table.getClassByQualifiedName(caller.module() + "." + caller.className());
    }

    /**
     * A callee imported by exactly that name. Imported classes resolve like constructor calls.
     */
    private @Nullable String resolveImport(String callee, Map<String, String> imports) {
        var target = imports.get(callee);
        if (target == null) {
            return null;
        }
        if (table.contains(target)) {
            return target;
        }
        var cls = table.getClassByQualifiedName(target);
        return cls == null ? null : constructorTarget(cls);
    }

    private @Nullable String resolveConstructor(String callee, PythonMetadata caller) {
        var cls = table.resolveClass(callee, caller.module(), caller.functionLocalImports());
        return cls == null ? null : constructorTarget(cls);
    }

    /** {@code Cls.__init__} when it exists, otherwise the class itself. */
    private String constructorTarget(PythonSymbolTable.ClassInfo cls) {
        var init = cls.qualifiedName() + ".__init__";
        return table.contains(init) ? init : cls.qualifiedName();
    }

    private @Nullable String resolveByPrefix(String callee, PythonMetadata caller) {
        if (!callee.contains(".")) {
            return null;
        }
        var parts = DOT_SPLITTER.splitToList(callee);
        var moduleImports = table.getImports(caller.module());
        for (int i = parts.size() - 1; i > 0; i--) {
            var prefix = String.join(".", parts.subList(0, i));
            var target = caller.functionLocalImports().get(prefix);
            if (target == null) {
                target = moduleImports.get(prefix);
            }
            if (target != null) {
                var candidate = target + "." + String.join(".", parts.subList(i, parts.size()));
                if (table.contains(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
