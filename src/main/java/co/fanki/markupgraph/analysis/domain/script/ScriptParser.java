package co.fanki.markupgraph.analysis.domain.script;

import co.fanki.markupgraph.shared.Preconditions;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses script text into a Closure Compiler syntax tree.
 *
 * <p>Only parsing runs: no type checking, no optimization passes. Each
 * call uses its own compiler instance, so parsers can be shared between
 * analysis runs. Diagnostics are collected instead of printed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScriptParser {

    /**
     * Outcome of parsing one script.
     *
     * @param root the SCRIPT node, or null when parsing failed hard
     * @param errors the parse errors, empty on success
     */
    public record Result(Node root, List<String> errors) {

        /** Checks whether the script parsed without errors. */
        public boolean parsed() {
            return root != null && errors.isEmpty();
        }
    }

    private final LanguageMode languageMode;

    /**
     * Creates a parser for the given language level.
     *
     * @param theLanguageMode the accepted language level
     */
    public ScriptParser(final LanguageMode theLanguageMode) {
        this.languageMode = Preconditions.requireNonNull(theLanguageMode,
                "Language mode is required");
    }

    /** Creates a parser that accepts the newest language level. */
    public ScriptParser() {
        this(LanguageMode.ECMASCRIPT_NEXT);
    }

    /**
     * Parses a script.
     *
     * @param fileName the name reported in diagnostics
     * @param source the script text
     * @return the parse result; never throws for bad input
     */
    public Result parse(final String fileName, final String source) {
        Preconditions.requireNonBlank(fileName, "File name is required");
        Preconditions.requireNonNull(source, "Script source is required");

        final Compiler compiler = new Compiler(new PrintStream(
                OutputStream.nullOutputStream(), true,
                StandardCharsets.UTF_8));

        final CompilerOptions options = new CompilerOptions();
        options.setLanguageIn(languageMode);
        compiler.initOptions(options);

        final Node root;
        try {
            root = compiler.parse(SourceFile.fromCode(fileName, source));
        } catch (final RuntimeException e) {
            return new Result(null, List.of("Parser failure: "
                    + e.getMessage()));
        }

        final List<String> errors = new ArrayList<>();
        for (final JSError error : compiler.getErrors()) {
            errors.add(error.getDescription());
        }
        return new Result(root, List.copyOf(errors));
    }
}
