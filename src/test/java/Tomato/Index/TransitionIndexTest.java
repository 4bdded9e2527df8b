package Tomato.Index;

import static Tomato.Machines.sym;
import static Tomato.Machines.word;

import Tomato.Engine.Engines;
import Tomato.Machines;
import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import Tomato.Model.Transition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

class TransitionIndexTest {

  private static BitSet bits(int... ids) {
    BitSet b = new BitSet();
    for (int id : ids) {
      b.set(id);
    }
    return b;
  }

  @Test
  void testEpsilonClosure() {
    MachineDefinition nfa = Machines.aPlusOrBPlus();
    TransitionIndex index = TransitionIndex.build(nfa);

    BitSet closure = index.epsilonClosure(bits(0));
    Assertions.assertEquals(bits(0, 1, 3), closure);
    Assertions.assertEquals(closure, index.epsilonClosure(closure));
    Assertions.assertEquals(bits(2), index.epsilonClosure(bits(2)));
    // the argument is left alone
    BitSet start = bits(0);
    index.epsilonClosure(start);
    Assertions.assertEquals(bits(0), start);
  }

  @Test
  void testEpsilonCycle() {
    MachineDefinition cycle = MachineDefinition.builder(ModelType.NFA)
        .addState("a", true, false)
        .addState("b")
        .addState("c")
        .addTransition(Transition.epsilon("a", "b"))
        .addTransition(Transition.epsilon("b", "c"))
        .addTransition(Transition.epsilon("c", "a"))
        .build();
    TransitionIndex index = TransitionIndex.build(cycle);
    Assertions.assertEquals(bits(0, 1, 2), index.epsilonClosure(bits(1)));
  }

  @Test
  void testLookup() {
    MachineDefinition nfa = Machines.endsIn01Nfa();
    TransitionIndex index = TransitionIndex.build(nfa);

    List<Transition> onZero = index.lookup(0, sym("0"));
    Assertions.assertEquals(2, onZero.size());
    // declaration order
    Assertions.assertEquals("q0", onZero.get(0).to());
    Assertions.assertEquals("q1", onZero.get(1).to());
    Assertions.assertEquals("q0", index.first(0, sym("0")).to());
    Assertions.assertNull(index.first(2, sym("0")));
    Assertions.assertEquals(3, index.outgoing(0).size());
    Assertions.assertEquals(bits(0, 1), index.move(bits(0), sym("0")));
    Assertions.assertEquals(bits(0, 2), index.move(bits(0, 1), sym("1")));
  }

  @Test
  void testLookupIsReadOnly() {
    MachineDefinition dfa = Machines.endsIn01Dfa();
    TransitionIndex index = TransitionIndexes.of(dfa);
    Assertions.assertThrows(UnsupportedOperationException.class, () -> index.lookup(0, sym("0")).clear());
    Assertions.assertThrows(UnsupportedOperationException.class,
        () -> index.lookup(0, sym("1"), null).remove(0));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> index.outgoing(1).clear());
    Assertions.assertEquals(1, index.lookup(0, sym("0")).size());
    Assertions.assertTrue(Engines.dfa(dfa).accepts(word("1101")));
  }

  @Test
  void testPushdownKeys() {
    MachineDefinition pda = Machines.parenthesesPdaWithBottom();
    TransitionIndex index = TransitionIndex.build(pda);
    Assertions.assertEquals(3, index.keyCount());
    Assertions.assertEquals(1, index.lookup(0, sym(")"), sym("(")).size());
    Assertions.assertTrue(index.lookup(0, sym(")"), sym("Z")).isEmpty());
    Assertions.assertEquals(1, index.lookup(0, Symbol.EPSILON).size());
  }

  @Test
  void testCache() {
    MachineDefinition dfa = Machines.endsIn01Dfa();
    TransitionIndex first = TransitionIndexes.of(dfa);
    Assertions.assertSame(first, TransitionIndexes.of(dfa));
    Assertions.assertTrue(TransitionIndexes.cachedCount() > 0);

    // equal content, different definition: separate entry
    Assertions.assertNotSame(first, TransitionIndexes.of(Machines.endsIn01Dfa()));

    TransitionIndexes.invalidate(dfa);
    TransitionIndex rebuilt = TransitionIndexes.of(dfa);
    Assertions.assertNotSame(first, rebuilt);
    Assertions.assertSame(dfa, rebuilt.definition());
  }
}
