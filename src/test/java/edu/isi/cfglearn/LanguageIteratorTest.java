package edu.isi.cfglearn;

import static edu.isi.cfglearn.Grammars.parse;
import static edu.isi.cfglearn.Grammars.toks;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

public class LanguageIteratorTest {

	private static List<List<Symbol>> take(Iterator<List<Symbol>> it, int n) {
		ArrayList<List<Symbol>> ret = new ArrayList<List<Symbol>>();
		for (int i = 0; i < n && it.hasNext(); i++)
			ret.add(it.next());
		return ret;
	}

	@Test
	public void shortestFirst() throws Exception {
		Recognizer r = new Recognizer(Grammars.load("ab.cfg"));
		List<List<Symbol>> got = take(r.language(), 3);
		assertEquals(3, got.size());
		assertEquals(toks("a b"), got.get(0));
		assertEquals(toks("a b a b"), got.get(1));
		assertEquals(toks("a b a b a b"), got.get(2));
	}

	@Test
	public void soundAndOrdered() throws Exception {
		Recognizer r = new Recognizer(Grammars.load("parens.cfg"));
		List<List<Symbol>> got = take(r.language(), 8);
		assertEquals(8, got.size());
		int last = 0;
		HashSet<List<Symbol>> seen = new HashSet<List<Symbol>>();
		for (List<Symbol> s : got) {
			assertTrue(SymbolFactory.toYield(s), r.recognize(s));
			assertTrue(s.size() >= last);
			assertTrue("repeated "+s, seen.add(s));
			last = s.size();
		}
	}

	// there are exactly three balanced strings of length 4 or less
	@Test
	public void completeForShortStrings() throws Exception {
		Recognizer r = new Recognizer(Grammars.load("parens.cfg"));
		HashSet<List<Symbol>> got = new HashSet<List<Symbol>>(take(r.language(), 3));
		HashSet<List<Symbol>> expected = new HashSet<List<Symbol>>();
		expected.add(toks("< >"));
		expected.add(toks("< < > >"));
		expected.add(toks("< > < >"));
		assertEquals(expected, got);
	}

	@Test
	public void nullableGrammar() throws Exception {
		Recognizer r = new Recognizer(parse("S\nS -> S A\nS -> *e*\n"));
		List<List<Symbol>> got = take(r.language(), 4);
		assertEquals(toks(""), got.get(0));
		assertEquals(toks("A"), got.get(1));
		assertEquals(toks("A A"), got.get(2));
		assertEquals(toks("A A A"), got.get(3));
	}

	@Test
	public void finiteLanguageEnds() throws Exception {
		Recognizer r = new Recognizer(parse("S\nS -> a\nS -> b c\n"));
		Iterator<List<Symbol>> it = r.language();
		assertTrue(it.hasNext());
		assertEquals(toks("a"), it.next());
		assertEquals(toks("b c"), it.next());
		assertFalse(it.hasNext());
		try {
			it.next();
			throw new AssertionError("expected the language to be exhausted");
		}
		catch (NoSuchElementException e) {
			// expected
		}
	}

	@Test
	public void onlyTheEmptyString() throws Exception {
		Iterator<List<Symbol>> it = new Recognizer(parse("S\nS -> *e*\n")).language();
		assertEquals(toks(""), it.next());
		assertFalse(it.hasNext());
	}

	// B never finishes, so only a is in the language
	@Test
	public void uselessRulesDontHang() throws Exception {
		Recognizer r = new Recognizer(parse("S\nS -> a\nS -> B\nB -> b B\n"));
		List<List<Symbol>> got = take(r.language(), 5);
		assertEquals(1, got.size());
		assertEquals(toks("a"), got.get(0));
	}

	@Test
	public void emptyLanguage() throws Exception {
		Recognizer r = new Recognizer(parse("S\nS -> S a\n"));
		assertFalse(r.language().hasNext());
	}

	@Test
	public void eachCallStartsOver() throws Exception {
		Recognizer r = new Recognizer(Grammars.load("anbn.cfg"));
		Iterator<List<Symbol>> first = r.language();
		assertEquals(toks("a b"), first.next());
		assertEquals(toks("a a b b"), first.next());
		assertEquals(toks("a b"), r.language().next());
		assertEquals(toks("a a a b b b"), first.next());
	}
}
