package Powerset.Model;

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ModelTest {
  @Test
  void testNondeterministicAutomaton() {
    NondeterministicAutomaton nfa = NondeterministicAutomaton.builder()
        .addStates(List.of("C", "A", "B"))
        .setInitial("A")
        .addFinal("C")
        .addEpsilonTransition("A", "B")
        .addTransition("B", '1', "C")
        .addTransition("B", '0', "C")
        .addTransition("B", '0', "C") // duplicate, counted once
        .build();

    Assertions.assertEquals(List.of("A", "B", "C"), nfa.getStates());
    Assertions.assertEquals(List.of('0', '1'), List.copyOf(nfa.getInputAlphabet()));
    Assertions.assertEquals(3, nfa.getTransitionCount());
    Assertions.assertTrue(nfa.hasEpsilonTransitions());
    Assertions.assertEquals("A", nfa.getInitialState());
    Assertions.assertEquals(Set.of("C"), nfa.getFinalStates());
    Assertions.assertEquals(Set.of("C"), nfa.getSuccessors("B", '0'));
    Assertions.assertEquals(Set.of(), nfa.getSuccessors("A", '0'));
    Assertions.assertEquals(Set.of(), nfa.getSuccessors("B", 'x'));
    Assertions.assertEquals(Set.of("B"), nfa.getEpsilonSuccessors("A"));
    Assertions.assertEquals(NondeterministicAutomaton.MISSING_STATE, nfa.getStateId("Z"));
    Assertions.assertTrue(nfa.isFinal(nfa.getStateId("C")));
  }

  @Test
  void testNondeterministicBuilderValidation() {
    assertThrows(IllegalArgumentException.class, () -> NondeterministicAutomaton.builder().addState("A").build());
    assertThrows(IllegalArgumentException.class,
        () -> NondeterministicAutomaton.builder().addState("A").setInitial("B").build());
    assertThrows(IllegalArgumentException.class,
        () -> NondeterministicAutomaton.builder().addState("A").setInitial("A").addFinal("X").build());
    assertThrows(IllegalArgumentException.class,
        () -> NondeterministicAutomaton.builder().addState("A").setInitial("A").addTransition("A", '0', "X").build());
    assertThrows(IllegalArgumentException.class, () -> NondeterministicAutomaton.builder().addState("a b"));
    assertThrows(IllegalArgumentException.class, () -> NondeterministicAutomaton.builder().addState(""));
  }

  @Test
  void testDeterministicAutomaton() {
    DeterministicAutomaton dfa = DeterministicAutomaton.builder(Alphabets.characters('0', '1'))
        .addState("q0", false)
        .addState("q1", true)
        .setInitial("q0")
        .setTransition("q0", '0', "q1")
        .setTransition("q0", '0', "q1") // same destination is fine
        .setTransition("q1", '1', "q1")
        .build();

    Assertions.assertEquals(List.of("q0", "q1"), dfa.getStates());
    Assertions.assertEquals(Set.of("q1"), dfa.getFinalStates());
    Assertions.assertEquals("q1", dfa.getSuccessor("q0", '0'));
    Assertions.assertNull(dfa.getSuccessor("q0", '1'));
    Assertions.assertNull(dfa.getSuccessor("q0", 'x'));
    Assertions.assertEquals(2, dfa.getTransitionCount());
    Assertions.assertTrue(dfa.containsState("q1"));
    Assertions.assertFalse(dfa.containsState("q2"));
    assertThrows(IllegalArgumentException.class, () -> dfa.isFinal("q2"));
  }

  @Test
  void testDeterministicBuilderValidation() {
    DeterministicAutomaton.Builder builder = DeterministicAutomaton.builder(Alphabets.characters('0', '1'))
        .addState("q0", false)
        .addState("q1", false)
        .setTransition("q0", '0', "q1");
    assertThrows(IllegalStateException.class, () -> builder.setTransition("q0", '0', "q0"));
    assertThrows(IllegalArgumentException.class, () -> builder.setTransition("q0", '2', "q0"));
    assertThrows(IllegalArgumentException.class, () -> builder.setTransition("q0", '1', "q9"));
    assertThrows(IllegalArgumentException.class, () -> builder.addState("q0", true));
    // no initial state yet
    assertThrows(IllegalStateException.class, builder::build);

    builder.setInitial("q0").build();
    assertThrows(IllegalStateException.class, () -> builder.addState("q2", false));
  }

  @Test
  void testToCompactDFA() {
    DeterministicAutomaton dfa = DeterministicAutomaton.builder(Alphabets.characters('0', '1'))
        .addState("q0", false)
        .addState("q1", true)
        .setInitial("q1")
        .setTransition("q1", '1', "q0")
        .build();
    CompactDFA<Character> compact = dfa.toCompactDFA();
    Assertions.assertEquals(2, compact.size());
    Assertions.assertEquals(Integer.valueOf(1), compact.getInitialState());
    Assertions.assertTrue(compact.isAccepting(1));
    Assertions.assertEquals(Integer.valueOf(0), compact.getSuccessor(Integer.valueOf(1), Character.valueOf('1')));
    Assertions.assertNull(compact.getSuccessor(Integer.valueOf(1), Character.valueOf('0')));
  }

  @Test
  void testDeterminization() {
    DeterministicAutomaton dfa = DeterministicAutomaton.builder(Alphabets.characters('0', '0'))
        .addState("q0", false)
        .setInitial("q0")
        .build();
    Determinization d = new Determinization(dfa, Map.of("q0", Set.of("A")));
    Assertions.assertEquals(Set.of("A"), d.getMembers("q0"));
    assertThrows(IllegalArgumentException.class, () -> d.getMembers("q1"));
    assertThrows(UnsupportedOperationException.class, () -> d.getCompositeStates().clear());
  }

  @Test
  void testDiagnostics() {
    Diagnostics diagnostics = new Diagnostics();
    Assertions.assertTrue(diagnostics.isEmpty());
    diagnostics.warn(4, "first");
    diagnostics.warn("second");
    diagnostics.error("third");

    Assertions.assertEquals(3, diagnostics.getEntries().size());
    Assertions.assertEquals(2, diagnostics.getWarnings().size());
    Assertions.assertTrue(diagnostics.hasErrors());
    Assertions.assertEquals("WARNING (line 4): first", diagnostics.getEntries().get(0).toString());
    Assertions.assertEquals("ERROR: third", diagnostics.getErrors().get(0).toString());
  }

  @Test
  void testVerdict() {
    Assertions.assertTrue(Verdict.ACCEPTED.isAccepted());
    Assertions.assertFalse(Verdict.REJECTED.isAccepted());
    Assertions.assertFalse(Verdict.REJECTED_UNKNOWN_SYMBOL.isAccepted());
  }
}
