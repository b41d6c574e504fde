package edu.isi.cfglearn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.util.List;

import org.junit.Test;

public class SymbolFactoryTest {

	@Test
	public void interning() {
		assertSame(SymbolFactory.getTerminal("x"), SymbolFactory.getTerminal(new String("x")));
		assertSame(SymbolFactory.getState("X"), SymbolFactory.getState("X"));
		assertNotSame(SymbolFactory.getTerminal("Q"), SymbolFactory.getState("Q"));
		assertTrue(SymbolFactory.getState("Q").isState());
		assertTrue(SymbolFactory.getTerminal("Q").isTerminal());
	}

	@Test
	public void tokenLines() {
		List<Symbol> t = SymbolFactory.getTerminals("  a   b\tc ");
		assertEquals(3, t.size());
		assertSame(SymbolFactory.getTerminal("b"), t.get(1));
		assertTrue(SymbolFactory.getTerminals("*e*").isEmpty());
		assertTrue(SymbolFactory.getTerminals("   ").isEmpty());
		assertEquals("a b c", SymbolFactory.toYield(t));
		assertEquals("*e*", SymbolFactory.toYield(SymbolFactory.getTerminals("")));
	}

	@Test
	public void stateLists() {
		List<Symbol> s = SymbolFactory.getStates("S A S B");
		assertEquals(3, s.size());
		assertSame(SymbolFactory.getState("S"), s.get(0));
	}

	@Test
	public void reservedSymbols() {
		assertTrue(Symbol.getGoal().isState());
		assertSame(Symbol.getEpsilon(), SymbolFactory.getTerminal("*e*"));
	}

	@Test
	public void verboseTrace() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Debug.setStream(bytes);
		try {
			MembershipOracle yes = new MembershipOracle() {
				public boolean isMember(Symbol state, List<Symbol> yield) {
					return true;
				}
			};
			CountingOracle co = new CountingOracle(yes, null, true);
			co.isMember(SymbolFactory.getState("S"), SymbolFactory.getTerminals("a b"));
		}
		finally {
			Debug.setStream(System.err);
		}
		assertEquals("S =>* a b? yes\n", bytes.toString("utf-8"));
	}
}
