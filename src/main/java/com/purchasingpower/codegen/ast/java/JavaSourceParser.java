package com.purchasingpower.codegen.ast.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.google.common.base.Preconditions;
import com.purchasingpower.codegen.ast.SourceParseException;
import com.purchasingpower.codegen.ast.SourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * JavaParser-backed adapter for Java candidates.
 *
 * <p>Accepts either a full compilation unit or a bare method. Code that does not parse
 * as a compilation unit is retried inside a synthetic holder class; reported line
 * numbers stay relative to the code as submitted.
 *
 * <p><b>Thread Safety:</b> A new {@link JavaParser} is created per call, so this adapter
 * can be shared across concurrently evaluated candidates.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaSourceParser implements SourceParser {

    static final String HOLDER_CLASS = "GeneratedCandidate";
    static final int WRAPPER_LINES = 1;

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(class|interface|enum|record)\\s+[A-Za-z_$][\\w$]*");

    private static final Pattern COMMENT_OR_LITERAL = Pattern.compile(
            "/\\*[\\s\\S]*?\\*/|//[^\\n]*|\"(?:\\\\.|[^\"\\\\\\n])*\"|'(?:\\\\.|[^'\\\\\\n])*'");

    @Override
    public String getLanguage() {
        return "java";
    }

    @Override
    public JavaParsedSource parse(String code) {
        Preconditions.checkNotNull(code, "Code cannot be null");

        ParseResult<CompilationUnit> direct = newParser().parse(code);
        if (direct.isSuccessful() && direct.getResult().isPresent()) {
            return new JavaParsedSource(direct.getResult().get(), false);
        }

        String holder = "class " + HOLDER_CLASS + " {\n" + code + "\n}\n";
        ParseResult<CompilationUnit> wrapped = newParser().parse(holder);
        if (wrapped.isSuccessful() && wrapped.getResult().isPresent()) {
            log.debug("Parsed candidate as bare method inside {}", HOLDER_CLASS);
            return new JavaParsedSource(wrapped.getResult().get(), true);
        }

        SourceParseException directError = toException(direct.getProblems(), 0);
        SourceParseException wrappedError = toException(wrapped.getProblems(), WRAPPER_LINES);
        throw furthest(code, directError, wrappedError);
    }

    /**
     * Both readings failed; the one whose first problem sits later in the code is the
     * one the author meant. On a tie a type declaration outside comments and literals
     * decides for the compilation-unit reading.
     */
    private SourceParseException furthest(String code, SourceParseException directError,
                                          SourceParseException wrappedError) {
        int directLine = lineOf(directError);
        int wrappedLine = lineOf(wrappedError);
        if (directLine != wrappedLine) {
            return directLine > wrappedLine ? directError : wrappedError;
        }
        String stripped = COMMENT_OR_LITERAL.matcher(code).replaceAll(" ");
        return TYPE_DECLARATION.matcher(stripped).find() ? directError : wrappedError;
    }

    private static int lineOf(SourceParseException error) {
        return error.getLineNumber() == null ? 0 : error.getLineNumber();
    }

    private JavaParser newParser() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(configuration);
    }

    private SourceParseException toException(List<Problem> problems, int lineOffset) {
        if (problems.isEmpty()) {
            return new SourceParseException("Code could not be parsed", null);
        }
        Problem first = problems.get(0);
        Integer line = first.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> Math.max(1, range.begin.line - lineOffset))
                .orElse(null);
        return new SourceParseException(first.getMessage(), line);
    }
}
