package Tomato.Engine;

import static Tomato.Machines.sym;
import static Tomato.Machines.word;

import Tomato.Machines;
import Tomato.Model.MachineDefinition;
import Tomato.Model.RunOptions;
import Tomato.Model.Symbol;
import Tomato.Trace.FiniteConfiguration;
import Tomato.Trace.ListTraceRecorder;
import Tomato.Trace.RunResult;
import Tomato.Trace.StepEvent;
import Tomato.Trace.StepKind;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class DfaEngineTest {
  private static final List<Symbol> BITS = List.of(sym("0"), sym("1"));

  @Test
  void testEndsIn01() {
    DfaEngine engine = Engines.dfa(Machines.endsIn01Dfa());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(word("1101")).verdict());
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("0110")).verdict());
    Assertions.assertEquals(Verdict.REJECT, engine.run(Word.epsilon()).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run("01", RunOptions.defaults()).verdict());
  }

  @Test
  void testStepwiseTrace() {
    DfaEngine engine = Engines.dfa(Machines.endsIn01Dfa());
    ListTraceRecorder recorder = new ListTraceRecorder();
    Simulation simulation = engine.start(word("1101"), RunOptions.defaults(), recorder);

    Assertions.assertEquals(Verdict.RUNNING, simulation.verdict());
    Assertions.assertEquals(FiniteConfiguration.of("q0", word("1101"), 0), simulation.current());

    StepEvent first = simulation.step();
    Assertions.assertEquals(StepKind.MOVE, first.kind());
    Assertions.assertEquals("q0", first.transition().to());
    Assertions.assertEquals(1, ((FiniteConfiguration) first.after()).position());

    RunResult result = simulation.run();
    Assertions.assertEquals(Verdict.ACCEPT, result.verdict());
    // one step per symbol and the final halt
    Assertions.assertEquals(5, result.steps());
    Assertions.assertEquals(5, recorder.events().size());
    Assertions.assertEquals(StepKind.HALT, recorder.last().kind());
    Assertions.assertEquals(FiniteConfiguration.of("q2", word("1101"), 4), result.last());
    for (StepEvent e : recorder.events().subList(0, 4)) {
      Assertions.assertEquals(0, e.branchId());
      Assertions.assertEquals(Verdict.RUNNING, e.verdict());
    }
    Assertions.assertThrows(IllegalStateException.class, simulation::step);
  }

  @Test
  void testStepwiseMatchesAccepts() {
    DfaEngine engine = Engines.dfa(Machines.endsIn01Dfa());
    for (Word<Symbol> w : Machines.allWords(BITS, 7)) {
      boolean expected = w.length() >= 2 && w.getSymbol(w.length() - 2).equals(sym("0"))
          && w.getSymbol(w.length() - 1).equals(sym("1"));
      Assertions.assertEquals(expected, engine.accepts(w), w.toString());
      Assertions.assertEquals(expected, engine.run(w).isAccepted(), w.toString());
    }
  }

  @Test
  void testUnknownSymbolRejects() {
    DfaEngine engine = Engines.dfa(Machines.endsIn01Dfa());
    Assertions.assertEquals(DfaEngine.REJECT, engine.step(0, sym("2")));
    Assertions.assertFalse(engine.accepts(word("012")));
    RunResult result = engine.run("0121", RunOptions.defaults());
    Assertions.assertEquals(Verdict.REJECT, result.verdict());
    Assertions.assertEquals(2, ((FiniteConfiguration) result.last()).position());
  }

  @Test
  void testCancel() {
    MachineDefinition dfa = Machines.endsIn01Dfa();
    Simulation simulation = Engines.forDefinition(dfa).start(word("010101"), RunOptions.defaults());
    simulation.step();
    simulation.cancel();
    StepEvent event = simulation.step();
    Assertions.assertEquals(StepKind.HALT, event.kind());
    Assertions.assertEquals(Verdict.CANCELLED, simulation.verdict());
    Assertions.assertTrue(simulation.isFinished());
    Assertions.assertEquals(2, simulation.steps());
  }
}
