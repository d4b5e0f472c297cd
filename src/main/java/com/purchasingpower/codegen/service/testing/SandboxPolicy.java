package com.purchasingpower.codegen.service.testing;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * What generated code may not touch while its tests run.
 *
 * <p>Two layers: a source scan rejecting forbidden APIs before anything is compiled,
 * and a class-name check applied by {@link SandboxClassLoader} when compiled code links
 * against the JDK.
 */
public final class SandboxPolicy {

    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");

    private static final Map<String, Pattern> FORBIDDEN_SOURCE = Map.of(
            "System.exit", Pattern.compile("\\bSystem\\s*\\.\\s*exit\\b"),
            "Runtime", Pattern.compile("\\bRuntime\\s*\\."),
            "ProcessBuilder", Pattern.compile("\\bProcessBuilder\\b"),
            "Thread", Pattern.compile("\\bThread\\b"),
            "java.io / java.nio / java.net", Pattern.compile("\\bjava\\s*\\.\\s*(io|nio|net)\\b"),
            "reflection", Pattern.compile("\\bjava\\s*\\.\\s*lang\\s*\\.\\s*reflect\\b|\\.\\s*setAccessible\\s*\\("
                    + "|\\bgetDeclared(Method|Field|Constructor)s?\\b|\\bClass\\s*\\.\\s*forName\\b"),
            "class loaders", Pattern.compile("\\bClassLoader\\b"),
            "method handles", Pattern.compile("\\bjava\\s*\\.\\s*lang\\s*\\.\\s*invoke\\b"
                    + "|\\b(MethodHandles?|MethodType|VarHandle|CallSite|LambdaMetafactory)\\b"),
            "System state", Pattern.compile("\\bSystem\\s*\\.\\s*(setProperty|setProperties|clearProperty"
                    + "|setIn|setOut|setErr|setSecurityManager|load|loadLibrary|getenv)\\b"));

    private static final List<String> FORBIDDEN_PACKAGES = List.of(
            "java.nio.file.",
            "java.nio.channels.",
            "java.net.",
            "java.lang.reflect.",
            "sun.",
            "jdk.internal.");

    private static final Set<String> FORBIDDEN_CLASSES = Set.of(
            "java.lang.Runtime",
            "java.lang.ProcessBuilder",
            "java.lang.ProcessHandle",
            "java.lang.Thread",
            "java.lang.ClassLoader",
            "java.io.File",
            "java.io.FileInputStream",
            "java.io.FileOutputStream",
            "java.io.FileReader",
            "java.io.FileWriter",
            "java.io.RandomAccessFile");

    private SandboxPolicy() {
    }

    /**
     * @return the name of the first forbidden API the source uses, if any
     */
    public static Optional<String> findForbiddenUsage(String sourceCode) {
        String withoutLiterals = STRING_LITERAL.matcher(sourceCode).replaceAll("\"\"");
        return FORBIDDEN_SOURCE.entrySet().stream()
                .filter(entry -> entry.getValue().matcher(withoutLiterals).find())
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst();
    }

    public static boolean isForbiddenClass(String binaryName) {
        return FORBIDDEN_CLASSES.contains(binaryName) || FORBIDDEN_PACKAGES.stream().anyMatch(binaryName::startsWith);
    }
}
