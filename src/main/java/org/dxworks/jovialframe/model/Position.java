package org.dxworks.jovialframe.model;

import java.util.Objects;

/**
 * Editor position: 0-based line and character.
 */
public final class Position {

    private final int line;
    private final int character;

    public Position(int line, int character) {
        this.line = line;
        this.character = character;
    }

    public int getLine() {
        return line;
    }

    public int getCharacter() {
        return character;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position position = (Position) o;
        return line == position.line && character == position.character;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
