package Powerset;

import java.util.BitSet;
import java.util.List;
import java.util.Set;

import Powerset.Model.NondeterministicAutomaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MoveTest {
  @Test
  void testDirectSuccessorsOnly() {
    NondeterministicAutomaton nfa = TestAutomata.example();
    // A only reaches C through the epsilon move to B, which move does not follow
    Assertions.assertEquals(Set.of(), Move.move(List.of("A"), '0', nfa));
    Assertions.assertEquals(Set.of("C"), Move.move(List.of("A", "B"), '0', nfa));
  }

  @Test
  void testUnion() {
    NondeterministicAutomaton nfa = TestAutomata.endsWith01();
    Assertions.assertEquals(Set.of("p", "r"), Move.move(List.of("p", "q"), '0', nfa));
    Assertions.assertEquals(Set.of("p"), Move.move(List.of("p", "q"), '1', nfa));
    Assertions.assertEquals(Set.of("s"), Move.move(List.of("r"), '1', nfa));
  }

  @Test
  void testNoMove() {
    NondeterministicAutomaton nfa = TestAutomata.exampleWithOne();
    Assertions.assertTrue(Move.move(List.of("A", "B"), '1', nfa).isEmpty());
    // not in the alphabet at all
    Assertions.assertTrue(Move.move(List.of("A", "B", "C"), 'x', nfa).isEmpty());
    Assertions.assertTrue(Move.move(new BitSet(), '0', nfa).isEmpty());
  }

  @Test
  void testUnknownState() {
    NondeterministicAutomaton nfa = TestAutomata.example();
    Assertions.assertThrows(IllegalArgumentException.class, () -> Move.move(List.of("Z"), '0', nfa));
  }
}
