package org.kidoni.calculator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.kidoni.calculator.expr.Expr;
import org.kidoni.calculator.expr.Expr.NumberExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;

/**
 * Console session: one statement per line until end of input. Errors are reported against the line and the
 * session carries on; only a failing input stream ends it early.
 */
public class Repl implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Repl.class);

    private final Evaluator evaluator;
    private final CalculatorProperties properties;
    private final InputStream input;
    private final PrintStream output;

    public Repl(final Evaluator evaluator, final CalculatorProperties properties, final InputStream input, final PrintStream output) {
        this.evaluator = evaluator;
        this.properties = properties;
        this.input = input;
        this.output = output;
    }

    @Override
    public void run(final String... args) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));

        int lines = 0;
        String line;
        while (true) {
            output.print(properties.prompt());
            output.flush();
            if ((line = reader.readLine()) == null) {
                break;
            }
            lines++;
            if (!line.isBlank()) {
                handle(line);
            }
        }

        output.println();
        log.debug("session ended after {} lines", lines);
    }

    void handle(final String line) {
        try {
            Expr statement = evaluator.parse(line);
            if (properties.echoParsed()) {
                output.println(" > " + statement);
            }
            evaluator.execute(statement).ifPresent(this::print);
        }
        catch (CalculatorException e) {
            log.debug("rejected '{}'", line, e);
            output.println("Error: " + e.getMessage());
        }
    }

    private void print(final Expr result) {
        output.println("  " + result);
        if (result instanceof NumberExpr number && !number.value().isInteger()) {
            output.println("  ≈ " + number.value().toDecimalString(properties.decimalPrecision()));
        }
    }
}
