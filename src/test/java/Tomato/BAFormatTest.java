package Tomato;

import static Tomato.Machines.word;

import Tomato.Convert.SubsetConstruction;
import Tomato.Engine.Engines;
import Tomato.Engine.NfaEngine;
import Tomato.Model.MachineDefinition;
import Tomato.Model.ModelType;
import Tomato.Model.Symbol;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;

class BAFormatTest {

  static MachineDefinition ends01() throws Exception {
    try (InputStream is = BAFormatTest.class.getResourceAsStream("/ends01.ba")) {
      return BAFormat.readNFA(is);
    }
  }

  @Test
  void testReadNFA() throws Exception {
    MachineDefinition nfa = ends01();
    Assertions.assertEquals(ModelType.NFA, nfa.type());
    Assertions.assertEquals(3, nfa.size());
    Assertions.assertEquals(1, nfa.acceptingStates().size());

    NfaEngine engine = Engines.nfa(nfa);
    Assertions.assertTrue(engine.accepts(word("1101")));
    Assertions.assertTrue(engine.accepts(word("01")));
    Assertions.assertFalse(engine.accepts(word("0110")));
    Assertions.assertFalse(engine.accepts(Word.epsilon()));
  }

  @Test
  void testWriteDFA() throws Exception {
    MachineDefinition nfa = ends01();
    MachineDefinition dfa = SubsetConstruction.toDfa(nfa);

    ByteArrayOutputStream os = new ByteArrayOutputStream();
    BAFormat.writeDFA(os, dfa);
    MachineDefinition reread = BAFormat.readNFA(new ByteArrayInputStream(os.toByteArray()));
    Assertions.assertEquals(dfa.size(), reread.size());

    NfaEngine source = Engines.nfa(nfa);
    NfaEngine roundTrip = Engines.nfa(reread);
    for (Word<Symbol> w : Machines.allWords(nfa.inputAlphabet(), 6)) {
      Assertions.assertEquals(source.accepts(w), roundTrip.accepts(w), w.toString());
    }
  }
}
