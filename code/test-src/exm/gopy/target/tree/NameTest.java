package exm.gopy.target.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

public class NameTest {

  @Test
  public void testContextDistinguishes() {
    assertEquals(Name.load("x"), Name.load("x"));
    assertFalse(Name.load("x").equals(Name.store("x")));
  }

  @Test
  public void testHashIsStable() {
    // Same value in every JVM: built from the id and the context ordinal
    assertEquals(31 * "x".hashCode(), Name.load("x").hashCode());
    assertEquals(31 * "x".hashCode() + 1, Name.store("x").hashCode());
    BinaryExpr e = new BinaryExpr(Name.load("a"), BinOperator.SUB,
                                  new LiteralInt(1));
    assertEquals(e.hashCode(), new BinaryExpr(Name.load("a"),
        BinOperator.SUB, new LiteralInt(1)).hashCode());
  }
}
