package Tomato;

import Tomato.Convert.RegularGrammar;
import Tomato.Convert.SubsetConstruction;
import Tomato.Engine.Engine;
import Tomato.Engine.Engines;
import Tomato.Model.InputTokenizer;
import Tomato.Model.InvalidMachineException;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import Tomato.Model.ValidationError;
import Tomato.Trace.ListTraceRecorder;
import Tomato.Trace.RunResult;
import Tomato.Trace.StepEvent;
import Tomato.Trace.TraceRecorder;
import Tomato.Trace.NoOpTraceRecorder;
import net.automatalib.word.Word;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class TomatoCommandLine {
  static final int OK = 0;
  static final int USAGE = 2;
  static final int INVALID = 3;

  public static void main(String[] args) {
    int code = execute(args, System.out);
    if (code != OK) {
      System.exit(code);
    }
  }

  static int execute(String[] args, PrintStream out) {
    String filename = null;
    boolean trace = false;
    RunOptions.NfaMode mode = RunOptions.NfaMode.SUBSET;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // read by slf4j-simple when the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--trace".equalsIgnoreCase(arg)) {
        trace = true;
      } else if ("--writeBA".equalsIgnoreCase(arg) || "--mode".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          out.println("Missing value for " + arg);
          return printUsage(out);
        }
        String value = args[++i];
        if ("--writeBA".equalsIgnoreCase(arg)) {
          filename = value;
        } else {
          try {
            mode = RunOptions.NfaMode.valueOf(value.toUpperCase(Locale.ROOT));
          } catch (IllegalArgumentException e) {
            out.println("Unknown mode: " + value);
            return printUsage(out);
          }
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        return printUsage(out);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      return printUsage(out);
    }
    String command = positional.get(0).toLowerCase(Locale.ROOT);
    String filePath = positional.get(1);
    List<String> words = positional.subList(2, positional.size());

    final MachineDefinition nfa = BAFormat.getBAFile(filePath);
    out.println("NFA states: " + nfa.size());
    out.println("Alphabet: " + nfa.inputAlphabet());

    try {
      return switch (command) {
        case "run" -> runWords(nfa, words, mode, trace, out);
        case "dfa" -> words.isEmpty() ? toDfa(nfa, filename, out) : printUsage(out);
        case "grammar" -> words.isEmpty() ? grammar(nfa, out) : printUsage(out);
        default -> printUsage(out);
      };
    } catch (InvalidMachineException e) {
      for (ValidationError error : e.getErrors()) {
        out.println(error);
      }
      return INVALID;
    }
  }

  private static int printUsage(PrintStream out) {
    out.println("Tomato [--debug] <command> <BA input file> ...");
    out.println("[--debug] : Additional debug output");
    out.println();
    out.println("<command> : one of the choices below:");
    out.println("  run [--mode subset|backtrack] [--trace] <BA file> <word>... : simulate each word.");
    out.println("      Symbols of a word are separated by ',', e.g. a,b,a. Use \"\" for the empty word.");
    out.println("  dfa [--writeBA <BA output file>] <BA file> : subset construction, with the minimized size; optionally write the DFA.");
    out.println("  grammar <BA file> : print a right-linear grammar for the language.");
    out.println();
    out.println("<BA file> : finite automaton (in the BA format).");
    out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    return USAGE;
  }

  /**
   * Simulate each word and print its verdict, preceded by the trace if asked for.
   */
  static int runWords(MachineDefinition nfa, List<String> words, RunOptions.NfaMode mode, boolean trace,
                      PrintStream out) {
    Engine engine = Engines.forDefinition(nfa);
    RunOptions options = RunOptions.builder().nfaMode(mode).build();
    for (String raw : words) {
      Word<Symbol> word = InputTokenizer.split(raw, ",");
      TraceRecorder recorder = trace ? new ListTraceRecorder() : NoOpTraceRecorder.INSTANCE;
      RunResult result = engine.run(word, options, recorder);
      for (StepEvent event : recorder.events()) {
        out.println("  " + event);
      }
      out.println((raw.isEmpty() ? Symbol.EPSILON.text() : raw) + ": " + result.verdict()
                  + " (" + result.steps() + " steps)");
    }
    return OK;
  }

  static int toDfa(MachineDefinition nfa, String filename, PrintStream out) {
    long before = System.currentTimeMillis();
    MachineDefinition dfa = SubsetConstruction.toDfa(nfa);
    long after = System.currentTimeMillis();
    out.println("SC DFA size: " + dfa.size());
    out.println("SC duration: " + ((after - before) / 1000f) + "s");
    out.println("Minimized DFA size: " + SubsetConstruction.minimize(dfa).size());
    out.println("start: " + dfa.startState().name());
    out.println("accepting: " + dfa.acceptingStates());
    for (Transition t : dfa.transitions()) {
      out.println("  " + t);
    }
    if (filename != null) {
      out.println("Writing to file: " + filename);
      BAFormat.writeBAFile(filename, dfa);
    }
    return OK;
  }

  static int grammar(MachineDefinition nfa, PrintStream out) {
    out.println(RegularGrammar.of(nfa));
    return OK;
  }
}
