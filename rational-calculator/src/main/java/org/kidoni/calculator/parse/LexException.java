package org.kidoni.calculator.parse;

import org.kidoni.calculator.CalculatorException;

public class LexException extends CalculatorException {
    private final char character;
    private final int position;

    public LexException(final char character, final int position) {
        super("unexpected character '" + character + "' at column " + position);
        this.character = character;
        this.position = position;
    }

    public char getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
