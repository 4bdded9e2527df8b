package Tomato.Model;

/**
 * Head movement of a Turing transition.
 */
public enum Move {
    LEFT(-1),
    RIGHT(1),
    STAY(0);

    private final int offset;

    Move(int offset) {
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
