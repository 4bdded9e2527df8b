package Tomato.Engine;

import static Tomato.Machines.sym;
import static Tomato.Machines.word;

import Tomato.Machines;
import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.RunOptions;
import Tomato.Model.RunOptions.StackAcceptance;
import Tomato.Model.Symbol;
import Tomato.Model.SymbolStack;
import Tomato.Model.Transition;
import Tomato.Trace.ListTraceRecorder;
import Tomato.Trace.PushdownConfiguration;
import Tomato.Trace.RunResult;
import Tomato.Trace.StepEvent;
import Tomato.Trace.StepKind;
import Tomato.Trace.Verdict;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class PdaEngineTest {
  private static final RunOptions FINAL_STATE = RunOptions.defaults();
  private static final RunOptions EMPTY_STACK = RunOptions.builder().stackAcceptance(StackAcceptance.EMPTY_STACK).build();
  private static final RunOptions EITHER = RunOptions.builder()
      .stackAcceptance(StackAcceptance.FINAL_STATE, StackAcceptance.EMPTY_STACK)
      .build();

  @Test
  void testParenthesesByEmptyStack() {
    PdaEngine engine = Engines.pda(Machines.parenthesesPda());
    Assertions.assertTrue(engine.initialStack().isEmpty());

    RunResult accepted = engine.run(word("(())"), EMPTY_STACK);
    Assertions.assertEquals(Verdict.ACCEPT, accepted.verdict());
    Assertions.assertEquals(5, accepted.steps());
    PushdownConfiguration last = (PushdownConfiguration) accepted.last();
    Assertions.assertTrue(last.stack().isEmpty());
    Assertions.assertTrue(last.inputExhausted());

    Assertions.assertEquals(Verdict.REJECT, engine.run(word("(()"), EMPTY_STACK).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(Word.epsilon(), EMPTY_STACK).verdict());
    // p is not accepting, so final-state acceptance never holds
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("()"), FINAL_STATE).verdict());
  }

  @Test
  void testUnderflowEndsBranch() {
    PdaEngine engine = Engines.pda(Machines.parenthesesPda());
    ListTraceRecorder recorder = new ListTraceRecorder();
    RunResult result = engine.run(word("())"), EMPTY_STACK, recorder);
    Assertions.assertEquals(Verdict.REJECT, result.verdict());

    StepEvent last = recorder.last();
    Assertions.assertEquals(StepKind.DEAD_BRANCH, last.kind());
    Assertions.assertEquals(sym("("), last.transition().pop());
    Assertions.assertSame(last.before(), last.after());
    PushdownConfiguration at = (PushdownConfiguration) last.after();
    Assertions.assertTrue(at.stack().isEmpty());
    Assertions.assertEquals(2, at.position());
  }

  @Test
  void testAcceptanceModes() {
    PdaEngine engine = Engines.pda(Machines.parenthesesPdaWithBottom());
    Assertions.assertEquals(SymbolStack.of(List.of(sym("Z"))), engine.initialStack());

    RunResult byFinalState = engine.run(word("(())"), FINAL_STATE);
    Assertions.assertEquals(Verdict.ACCEPT, byFinalState.verdict());
    PushdownConfiguration last = (PushdownConfiguration) byFinalState.last();
    Assertions.assertEquals("f", last.state());
    Assertions.assertEquals(List.of(sym("Z")), last.stack().toList());

    // the bottom marker is never popped for good
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("(())"), EMPTY_STACK).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(word("(())"), EITHER).verdict());
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("(()"), EITHER).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(Word.epsilon(), FINAL_STATE).verdict());
  }

  @Test
  void testEvenPalindromes() {
    Symbol a = sym("a");
    Symbol b = sym("b");
    Symbol z = sym("Z");
    MachineDefinition palindromes = MachineDefinition.builder(ModelType.PDA)
        .addState("push", true, false)
        .addState("pop")
        .addState("done", false, true)
        .stackAlphabet("Z", "a", "b")
        .initialStackSymbol(z)
        .addTransition(Transition.pda("push", a, Symbol.EPSILON, "push", List.of(a)))
        .addTransition(Transition.pda("push", b, Symbol.EPSILON, "push", List.of(b)))
        .addTransition(Transition.pda("push", Symbol.EPSILON, Symbol.EPSILON, "pop", List.of()))
        .addTransition(Transition.pda("pop", a, a, "pop", List.of()))
        .addTransition(Transition.pda("pop", b, b, "pop", List.of()))
        .addTransition(Transition.pda("pop", Symbol.EPSILON, z, "done", List.of(z)))
        .build();
    PdaEngine engine = Engines.pda(palindromes);
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(word("abba"), FINAL_STATE).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(word("aa"), FINAL_STATE).verdict());
    Assertions.assertEquals(Verdict.ACCEPT, engine.run(Word.epsilon(), FINAL_STATE).verdict());
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("abab"), FINAL_STATE).verdict());
    Assertions.assertEquals(Verdict.REJECT, engine.run(word("aba"), FINAL_STATE).verdict());

    ListTraceRecorder recorder = new ListTraceRecorder();
    engine.run(word("abba"), FINAL_STATE, recorder);
    Assertions.assertTrue(recorder.events().stream().anyMatch(StepEvent::isDeadBranch));
    Assertions.assertTrue(recorder.events().stream().anyMatch(e -> e.branchId() > 0));
  }

  @Test
  void testEpsilonPushLoopTimesOut() {
    MachineDefinition growing = MachineDefinition.builder(ModelType.PDA)
        .addState("p", true, true)
        .addTransition(Transition.pda("p", Symbol.EPSILON, Symbol.EPSILON, "p", List.of(sym("A"))))
        .build();
    ListTraceRecorder recorder = new ListTraceRecorder();
    RunOptions options = RunOptions.builder().maxSteps(50).build();
    RunResult result = Engines.pda(growing).run(word("a"), options, recorder);

    Assertions.assertEquals(Verdict.TIMEOUT, result.verdict());
    Assertions.assertEquals(StepKind.DEAD_BRANCH, recorder.last().kind());
    Assertions.assertEquals(50, recorder.events().stream()
        .filter(e -> e.kind() == StepKind.MOVE && e.transition() != null)
        .count());
  }

  @Test
  void testCutEpsilonBranchLeavesOthers() {
    MachineDefinition growing = MachineDefinition.builder(ModelType.PDA)
        .addState("p", true, false)
        .addState("f", false, true)
        .addTransition(Transition.pda("p", Symbol.EPSILON, Symbol.EPSILON, "p", List.of(sym("A"))))
        .addTransition(Transition.pda("p", sym("a"), Symbol.EPSILON, "f", List.of()))
        .build();
    RunOptions options = RunOptions.builder().maxSteps(20).build();
    RunResult result = Engines.pda(growing).run(word("a"), options);

    Assertions.assertEquals(Verdict.ACCEPT, result.verdict());
    Assertions.assertEquals("f", ((PushdownConfiguration) result.last()).state());
    // no path reads both symbols, but a cut branch leaves the answer open
    Assertions.assertEquals(Verdict.TIMEOUT, Engines.pda(growing).run(word("aa"), options).verdict());
  }

  @Test
  void testLongInputIsNotStepLimited() {
    PdaEngine engine = Engines.pda(Machines.parenthesesPda());
    Word<Symbol> balanced = word("(".repeat(6000) + ")".repeat(6000));
    RunResult result = engine.run(balanced, EMPTY_STACK);
    Assertions.assertEquals(Verdict.ACCEPT, result.verdict());
    Assertions.assertTrue(result.steps() > RunOptions.defaults().maxSteps());

    Word<Symbol> unbalanced = word("(".repeat(6000) + ")".repeat(5999));
    Assertions.assertEquals(Verdict.REJECT, engine.run(unbalanced, EMPTY_STACK).verdict());
  }
}
