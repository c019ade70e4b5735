package Powerset.Registry;

import Powerset.TestAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegistryTest {
  @Test
  void testCompositeStateRegistry() {
    CompositeStateRegistry registry = new CompositeStateRegistry(new StateNamer());
    BitSet b = TestAutomata.convertListToBitSet(List.of(1,2,3));
    Assertions.assertEquals(CompositeStateRegistry.MISSING_ELEMENT, registry.get(b));

    Assertions.assertEquals(0, registry.put(b));
    Assertions.assertEquals(0, registry.get(b));
    Assertions.assertEquals("q0", registry.getName(0));

    b = TestAutomata.convertListToBitSet(List.of(1));
    Assertions.assertEquals(1, registry.put(b));
    Assertions.assertEquals(1, registry.get(TestAutomata.convertListToBitSet(List.of(1))));
    Assertions.assertEquals("q1", registry.getName(1));
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals("Registry[2 composite states, names q<n>]", registry.toString());
  }

  @Test
  void testKeyIsCopied() {
    CompositeStateRegistry registry = new CompositeStateRegistry(new StateNamer());
    BitSet b = TestAutomata.convertListToBitSet(List.of(0,2));
    registry.put(b);
    b.set(5);
    Assertions.assertEquals(TestAutomata.convertListToBitSet(List.of(0,2)), registry.getMembers(0));
    Assertions.assertEquals(0, registry.get(TestAutomata.convertListToBitSet(List.of(0,2))));
    Assertions.assertEquals(CompositeStateRegistry.MISSING_ELEMENT, registry.get(b));
  }

  @Test
  void testInvalidPut() {
    CompositeStateRegistry registry = new CompositeStateRegistry(new StateNamer());
    assertThrows(IllegalArgumentException.class, () -> registry.put(new BitSet()));
    registry.put(TestAutomata.convertListToBitSet(List.of(4)));
    assertThrows(IllegalArgumentException.class, () -> registry.put(TestAutomata.convertListToBitSet(List.of(4))));
  }

  @Test
  void testStateNamer() {
    StateNamer namer = new StateNamer("D");
    Assertions.assertEquals("D0", namer.name(0));
    Assertions.assertEquals("D12", namer.name(12));
    Assertions.assertEquals("D", namer.getPrefix());
    Assertions.assertEquals("q3", new StateNamer().name(3));
    assertThrows(IllegalArgumentException.class, () -> namer.name(-1));
    assertThrows(IllegalArgumentException.class, () -> new StateNamer(""));
    assertThrows(IllegalArgumentException.class, () -> new StateNamer("a b"));
  }
}
