package io.github.cyfko.curatorkit.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled regular expressions shared by the parsers and the ontology builder.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /**
     * Identifiers of both DSLs: start with a letter or underscore, then letters, digits or underscores.
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Bare (unquoted) JSON values that are evaluated as arithmetic, e.g. {@code 5+5} or {@code 20 // 2}.
     */
    public static final Pattern ARITHMETIC_PATTERN = Pattern.compile("^[\\d.\\s+\\-*/()%]+$");

    /**
     * Ontology cells of the form {@code "Name (CODE)"}; the code must be the trailing token.
     */
    public static final Pattern NAME_CODE_PATTERN = Pattern.compile("\\(([^()]+)\\)\\s*$");

    /**
     * Lookahead that reveals a missing {@code '}'} in JSON: a sibling object ({@code ,{})
     * or the end of the enclosing array ({@code ]}) shows up before the object was closed.
     */
    public static final Pattern JSON_MISSING_BRACE_LOOKAHEAD = Pattern.compile("^(,\\s*\\{|\\s*])");
}
