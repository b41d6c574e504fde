package edu.isi.cfglearn;

import static edu.isi.cfglearn.Grammars.parse;
import static edu.isi.cfglearn.Grammars.state;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

public class NullabilityTest {
	private CFGRuleSet g;
	private Nullability nul;

	@Before
	public void setUp() throws Exception {
		g = parse("S\nS -> A B\nA -> *e*\nA -> a\nB -> A A\nB -> b B\nC -> c\nD -> D\n");
		nul = new Nullability(g);
	}

	@Test
	public void nullableStates() {
		assertTrue(nul.isNullable(state("S")));
		assertTrue(nul.isNullable(state("A")));
		assertTrue(nul.isNullable(state("B")));
		assertFalse(nul.isNullable(state("C")));
		assertFalse(nul.isNullable(state("D")));
		assertEquals(3, nul.getNullableStates().size());
	}

	@Test
	public void fewestSteps() {
		assertEquals(1, nul.getEmptySteps(state("A")));
		assertEquals(3, nul.getEmptySteps(state("B")));
		assertEquals(5, nul.getEmptySteps(state("S")));
	}

	@Test
	public void nullFree() {
		CFGRuleSet nf = nul.getNullFree();
		assertEquals(g.getNumRules()-1, nf.getNumRules());
		for (CFGRule r : nf.getRules())
			assertFalse(r.isEpsilon());
		assertEquals(g.getStartState(), nf.getStartState());
		assertTrue(nf.getStates().contains(state("A")));
	}

	@Test
	public void emptyDerivation() {
		DerivationTree t = nul.getEmptyDerivation(state("S"), 2);
		assertEquals("S(A(*e*) B(A(*e*) A(*e*)))", t.toString());
		assertEquals(2, t.getStart());
		assertEquals(2, t.getEnd());
		assertTrue(t.getYield().isEmpty());
		assertEquals(5, t.getNumSteps());
		for (CFGRule r : t.getRules())
			assertTrue(g.hasRule(r));
		assertNull(nul.getEmptyDerivation(state("C"), 0));
	}

	// the cheaper rule wins even when it is listed second
	@Test
	public void cheapestWitness() throws Exception {
		Nullability n = new Nullability(parse("S\nS -> X X\nS -> X\nX -> *e*\n"));
		assertEquals(2, n.getEmptySteps(state("S")));
		assertEquals("S(X(*e*))", n.getEmptyDerivation(state("S"), 0).toString());
	}
}
