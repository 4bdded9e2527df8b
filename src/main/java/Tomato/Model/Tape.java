package Tomato.Model;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.List;

/**
 * Sparse, two-way infinite Turing tape. Only non-blank cells are stored.
 */
public final class Tape {
    private final Int2ObjectOpenHashMap<Symbol> cells;
    private final Symbol blank;

    public Tape(Symbol blank) {
        this.blank = blank;
        this.cells = new Int2ObjectOpenHashMap<>();
        this.cells.defaultReturnValue(blank);
    }

    private Tape(Tape other) {
        this.blank = other.blank;
        this.cells = new Int2ObjectOpenHashMap<>(other.cells);
        this.cells.defaultReturnValue(blank);
    }

    /**
     * Tape holding {@code input} at cells 0..n-1.
     */
    public static Tape of(Word<Symbol> input, Symbol blank) {
        Tape tape = new Tape(blank);
        for (int i = 0; i < input.length(); i++) {
            tape.write(i, input.getSymbol(i));
        }
        return tape;
    }

    public Symbol read(int position) {
        return cells.get(position);
    }

    public void write(int position, Symbol symbol) {
        if (symbol.equals(blank)) {
            cells.remove(position);
        } else {
            cells.put(position, symbol);
        }
    }

    public Symbol blank() {
        return blank;
    }

    public Tape copy() {
        return new Tape(this);
    }

    public boolean isBlank() {
        return cells.isEmpty();
    }

    public int leftmost() {
        int min = Integer.MAX_VALUE;
        for (Int2ObjectMap.Entry<Symbol> e : cells.int2ObjectEntrySet()) {
            min = Math.min(min, e.getIntKey());
        }
        return cells.isEmpty() ? 0 : min;
    }

    public int rightmost() {
        int max = Integer.MIN_VALUE;
        for (Int2ObjectMap.Entry<Symbol> e : cells.int2ObjectEntrySet()) {
            max = Math.max(max, e.getIntKey());
        }
        return cells.isEmpty() ? -1 : max;
    }

    /**
     * @return cells from the leftmost to the rightmost non-blank cell, blanks in between included
     */
    public Word<Symbol> contents() {
        int from = leftmost();
        int to = rightmost();
        List<Symbol> result = new ArrayList<>(Math.max(0, to - from + 1));
        for (int i = from; i <= to; i++) {
            result.add(read(i));
        }
        return Word.fromList(result);
    }

    /**
     * @return the non-blank contents as text, one symbol after the other
     */
    public String contentString() {
        StringBuilder sb = new StringBuilder();
        for (Symbol s : contents()) {
            sb.append(s.text());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Tape && ((Tape) o).cells.equals(cells) && ((Tape) o).blank.equals(blank);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return contentString();
    }
}
