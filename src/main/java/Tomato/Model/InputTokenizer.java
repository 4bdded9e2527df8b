package Tomato.Model;

import net.automatalib.word.Word;
import net.automatalib.word.WordBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw text into symbols. Symbols may span several characters ("aa"), so at every position the
 * longest alphabet symbol that matches wins. A character no symbol matches becomes a one-character
 * symbol of its own, which the machine will then fail to read.
 */
public final class InputTokenizer {
    private final List<Symbol> byLength;

    public InputTokenizer(Collection<Symbol> alphabet) {
        this.byLength = new ArrayList<>();
        for (Symbol s : alphabet) {
            if (!s.isSentinel()) {
                byLength.add(s);
            }
        }
        byLength.sort(Comparator.comparingInt((Symbol s) -> s.text().length()).reversed()
                                .thenComparing(Comparator.naturalOrder()));
    }

    public static Word<Symbol> tokenize(String raw, Collection<Symbol> alphabet) {
        return new InputTokenizer(alphabet).tokenize(raw);
    }

    public Word<Symbol> tokenize(String raw) {
        WordBuilder<Symbol> result = new WordBuilder<>(raw.length());
        int pos = 0;
        while (pos < raw.length()) {
            Symbol match = null;
            for (Symbol s : byLength) {
                if (raw.startsWith(s.text(), pos)) {
                    match = s;
                    break;
                }
            }
            if (match == null) {
                match = Symbol.of(raw.charAt(pos));
            }
            result.append(match);
            pos += match.text().length();
        }
        return result.toWord();
    }

    /**
     * Split on a separator instead of matching against an alphabet, e.g. "a0,a1,a0".
     */
    public static Word<Symbol> split(String raw, String separator) {
        if (raw.isEmpty()) {
            return Word.epsilon();
        }
        List<Symbol> result = new ArrayList<>();
        for (String part : raw.split(Pattern.quote(separator))) {
            if (!part.isEmpty()) {
                result.add(Symbol.of(part));
            }
        }
        return Word.fromList(result);
    }
}
