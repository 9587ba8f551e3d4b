package org.kidoni.calculator;

import java.util.Optional;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.AssignExpr;
import org.kidoni.calculator.expr.Expr.BinaryExpr;
import org.kidoni.calculator.expr.Expr.NameExpr;
import org.kidoni.calculator.expr.Expr.TupleExpr;
import org.kidoni.calculator.parse.AssignTargetException;
import org.kidoni.calculator.parse.Lexer;
import org.kidoni.calculator.parse.Parser;
import org.kidoni.calculator.rewrite.Normalizer;
import org.kidoni.calculator.rewrite.Simplifier;
import org.kidoni.calculator.store.UnresolvedReferenceException;
import org.kidoni.calculator.store.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one statement through lex, parse, substitution, normalize and simplify.
 * <p>
 * Assignments store the right-hand side as written; bound names are substituted each time an expression uses
 * them, so a binding sees later rebinding of the names it mentions. Unbound names stay symbolic.
 */
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final VariableStore store;
    private final Normalizer normalizer;
    private final Simplifier simplifier;
    private final int maxDepth;

    public Evaluator(final VariableStore store, final Normalizer normalizer, final Simplifier simplifier) {
        this(store, normalizer, simplifier, Parser.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest nesting, and longest operator run, accepted from one line
     */
    public Evaluator(final VariableStore store, final Normalizer normalizer, final Simplifier simplifier, final int maxDepth) {
        this.store = store;
        this.normalizer = normalizer;
        this.simplifier = simplifier;
        this.maxDepth = maxDepth;
    }

    public Expr parse(final String line) {
        return new Parser(new Lexer(line).tokenize(), maxDepth).parse();
    }

    /**
     * @return the simplified result, or empty for an assignment
     */
    public Optional<Expr> evaluate(final String line) {
        return execute(parse(line));
    }

    public Optional<Expr> execute(final Expr statement) {
        if (statement instanceof AssignExpr assign) {
            if (!(assign.target() instanceof NameExpr name)) {
                throw new AssignTargetException(assign.target());
            }
            store.insert(name.name(), assign.value());
            return Optional.empty();
        }

        Expr substituted = substitute(statement);
        Expr normalized = normalizer.normalize(substituted);
        log.debug("normalized {} to {}", substituted, normalized);
        Expr simplified = simplifier.simplify(normalized);
        log.debug("simplified {} to {}", normalized, simplified);
        return Optional.of(simplified);
    }

    Expr substitute(final Expr expr) {
        if (expr instanceof NameExpr name) {
            return resolve(name);
        }
        if (expr instanceof BinaryExpr binary) {
            return new BinaryExpr(substitute(binary.left()), binary.op(), substitute(binary.right()));
        }
        if (expr instanceof TupleExpr tuple) {
            return new TupleExpr(tuple.elements().stream().map(this::substitute).toList());
        }
        return expr;
    }

    private Expr resolve(final NameExpr name) {
        if (store.isResolving(name.name())) {
            throw UnresolvedReferenceException.cyclic(name.name());
        }
        Optional<Expr> bound = store.get(name.name());
        if (bound.isEmpty()) {
            return name;
        }
        return store.resolving(name.name(), () -> substitute(bound.get()));
    }
}
