package edu.isi.cfglearn;

import static edu.isi.cfglearn.Grammars.parse;
import static edu.isi.cfglearn.Grammars.state;
import static edu.isi.cfglearn.Grammars.toks;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class OracleTest {

	// counts what reaches it
	private static class Tally implements MembershipOracle {
		int calls = 0;
		public boolean isMember(Symbol state, List<Symbol> yield) {
			calls++;
			return yield.size() % 2 == 0;
		}
	}

	@Test
	public void grammarMembershipAnyState() throws Exception {
		GrammarMembershipOracle o = new GrammarMembershipOracle(Grammars.load("anbn.cfg"));
		assertTrue(o.isMember(state("S"), toks("a a b b")));
		assertFalse(o.isMember(state("S"), toks("a b b")));
		assertTrue(o.isMember(state("T"), toks("a b b")));
		assertTrue(o.isMember(state("B"), toks("b")));
		assertFalse(o.isMember(state("B"), toks("a")));
	}

	@Test
	public void caching() {
		Tally t = new Tally();
		CachingMembershipOracle c = new CachingMembershipOracle(t);
		ArrayList<Symbol> y = new ArrayList<Symbol>(toks("a b"));
		assertTrue(c.isMember(state("S"), y));
		// a caller changing its list afterwards doesn't disturb the cache
		y.add(SymbolFactory.getTerminal("c"));
		assertTrue(c.isMember(state("S"), toks("a b")));
		assertEquals(1, t.calls);
		assertEquals(1, c.getHits());
		assertFalse(c.isMember(state("A"), toks("a b c")));
		assertTrue(c.isMember(state("A"), toks("a b")));
		assertEquals(3, t.calls);
	}

	private SampleCounterExampleOracle abTeacher(int samples) throws Exception {
		CFGRuleSet target = Grammars.load("ab.cfg");
		return new SampleCounterExampleOracle(new GrammarMembershipOracle(target), target.getStartState(),
				Grammars.strings("ab.txt"), samples);
	}

	@Test
	public void sampleAcceptsTarget() throws Exception {
		assertNull(abTeacher(10).findCounterExample(Grammars.load("ab.cfg")));
	}

	@Test
	public void sampleFindsMissingPositive() throws Exception {
		CFGRuleSet onlyOne = parse("S\nS -> A B\nA -> a\nB -> b\n");
		assertEquals(toks("a b a b"), abTeacher(10).findCounterExample(onlyOne));
	}

	@Test
	public void sampleFindsOvergeneration() throws Exception {
		CFGRuleSet tooBig = parse("S\nS -> S S\nS -> A B\nS -> a\nA -> a\nB -> b\n");
		assertEquals(toks("a"), abTeacher(10).findCounterExample(tooBig));
	}

	// the bad string is the fourth one, so three samples miss it
	@Test
	public void sampleOnlyLooksAtN() throws Exception {
		CFGRuleSet g = parse("S\nS -> S S\nS -> A B\nS -> A A A A A A A\nA -> a\nB -> b\n");
		assertNull(abTeacher(3).findCounterExample(g));
		assertEquals(toks("a a a a a a a"), abTeacher(4).findCounterExample(g));
	}

	@Test
	public void interactiveCounterExample() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "utf-8");
		InteractiveOracle io = new InteractiveOracle(new BufferedReader(new StringReader("\na a b\n")), out);
		CFGRuleSet g = Grammars.load("ab.cfg");
		assertNull(io.findCounterExample(g));
		assertEquals(toks("a a b"), io.findCounterExample(g));
		// end of input accepts
		assertNull(io.findCounterExample(g));
		String said = bytes.toString("utf-8");
		assertTrue(said.startsWith("Correct?"));
		assertTrue(said.contains("S -> A B"));
		assertTrue(said.contains("Blank for yes, Counter-example for no: "));
	}

	@Test
	public void interactiveMember() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "utf-8");
		InteractiveOracle io = new InteractiveOracle(new BufferedReader(new StringReader("y\nNo\nYES\n\n")), out);
		assertTrue(io.isMember(state("S"), toks("a b")));
		assertFalse(io.isMember(state("A"), toks("b")));
		assertTrue(io.isMember(state("S"), toks("")));
		assertFalse(io.isMember(state("S"), toks("a")));
		String said = bytes.toString("utf-8");
		assertTrue(said.startsWith("S =>* a b? Y/N: "));
		assertTrue(said.contains("S =>* *e*? Y/N: "));
	}

	@Test
	public void counting() throws Exception {
		Tally t = new Tally();
		CountingOracle co = new CountingOracle(t, abTeacher(10), false);
		co.isMember(state("S"), toks("a b"));
		co.isMember(state("S"), toks("a b"));
		assertNull(co.findCounterExample(Grammars.load("ab.cfg")));
		assertEquals(2, co.getMemberCalls());
		assertEquals(1, co.getCounterCalls());
		assertEquals(2, t.calls);
	}
}
