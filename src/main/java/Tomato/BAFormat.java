package Tomato;

import Tomato.Convert.AutomatonBridge;
import Tomato.Model.MachineDefinition;
import Tomato.Model.Symbol;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

import java.io.*;

public class BAFormat {
    /*
    Automatalib parses into a CompactNFA<String>; labels become symbols of an NFA definition
     */
    public static MachineDefinition readNFA(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return AutomatonBridge.fromCompactNFA(automaton);
    }

    public static void writeDFA(OutputStream os, MachineDefinition dfa) throws IOException {
        final CompactDFA<Symbol> compact = AutomatonBridge.toCompactDFA(dfa);
        new BAWriter<Symbol>().writeModel(os, compact, compact.getInputAlphabet());
    }

    static MachineDefinition getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return readNFA(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    static void writeBAFile(String filePath, MachineDefinition dfa) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            writeDFA(os, dfa);
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }
}
