package io.github.cyfko.curatorkit.core.api;

import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import io.github.cyfko.curatorkit.core.impl.RuleDslParser;
import io.github.cyfko.curatorkit.core.model.Criterion;

import java.util.List;

/**
 * Parser turning the text of one of the CuratorKit DSLs into a {@link Criterion} tree.
 * <p>
 * Two grammars implement this contract:
 * </p>
 * <table border="1">
 * <caption>DSL Reference</caption>
 * <thead>
 * <tr><th>Parser</th><th>Leaf</th><th>Composite</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link CriterionDslParser}</td><td>{@code age(min=18, unit="years")}</td>
 *     <td>{@code and{...}}, {@code or{...}}, {@code not{...}}, {@code if{...} then{...} else{...}}</td></tr>
 * <tr><td>{@link RuleDslParser}</td><td>{@code HAS_ALAT_ULN_OF_AT_MOST_X[1.0]}</td>
 *     <td>{@code AND(...)}, {@code OR(...)}, {@code NOT(...)}</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * DslParser parser = new CriterionDslParser();
 * Criterion tree = parser.parse("not{or{histology(histology_type=\"sarcomatoid\"), histology(histology_type=\"spindle cell\")}}");
 *
 * DslParser rules = new RuleDslParser();
 * Criterion rule = rules.parse("AND(IS_MALE, HAS_ASAT_ULN_OF_AT_MOST_X[1.0])");
 * }</pre>
 *
 * <h2>Error Detection</h2>
 * <p>
 * Any text that does not match the grammar raises a {@link DSLSyntaxException} located at
 * the offending character. Implementations are stateless facades and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DslParser {

    /**
     * Parses a text holding exactly one root criterion.
     *
     * @param text the DSL text
     * @return the parsed tree
     * @throws DSLSyntaxException if the text is null, blank, or not valid for the grammar
     */
    Criterion parse(String text) throws DSLSyntaxException;

    /**
     * Parses a text holding zero or more root criteria, separated by whitespace or commas.
     *
     * @param text the DSL text
     * @return the roots, in textual order
     * @throws DSLSyntaxException if the text is null or not valid for the grammar
     */
    List<Criterion> parseForest(String text) throws DSLSyntaxException;
}
