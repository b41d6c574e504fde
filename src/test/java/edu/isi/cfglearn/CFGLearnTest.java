package edu.isi.cfglearn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Test;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

public class CFGLearnTest {

	private static String path(String name) throws Exception {
		return Grammars.file(name).getPath();
	}

	private static String run(String[] argv, String stdin) throws Exception {
		JSAPResult config = CFGLearn.processParameters(new JSAP(), argv);
		assertTrue(config.success());
		StringWriter w = new StringWriter();
		PrintStream console = new PrintStream(new ByteArrayOutputStream(), true, "utf-8");
		CFGLearn.run(config, new BufferedReader(new StringReader(stdin)), console, w);
		return w.toString();
	}

	@Test
	public void recognize() throws Exception {
		String out = run(new String[] { path("anbn.cfg"), path("strings.txt") }, "");
		assertEquals("yes 3\nyes 7\nno\nno\n", out);
	}

	@Test
	public void recognizeWithTrees() throws Exception {
		String out = run(new String[] { "-d", path("anbn.cfg"), path("strings.txt") }, "");
		assertEquals("S(A(a) B(b))\nS(A(a) T(S(A(a) B(b)) B(b)))\nno\nno\n", out);
	}

	@Test
	public void enumerate() throws Exception {
		String out = run(new String[] { "-k", "3", path("ab.cfg") }, "");
		assertEquals("a b\na b a b\na b a b a b\n", out);
	}

	@Test
	public void check() throws Exception {
		String out = run(new String[] { "--check", path("parens.cfg") }, "");
		assertTrue(out.startsWith("3 states, 8 rules, 2 terminals\n"));
		assertTrue(out.contains("start: S\n"));
		assertTrue(out.contains("nullable:\n"));
		assertTrue(out.contains("CNF: yes\n"));
	}

	@Test
	public void learn() throws Exception {
		String out = run(new String[] { "-l", "--samples", "6", path("ab.cfg"), path("ab.txt") }, "");
		assertTrue(out.startsWith("S\n"));
		assertTrue(out.contains("hypotheses"));
		// the output reads back in as a grammar
		CFGRuleSet learned = CFGRuleSet.fromString(out);
		assertTrue(new Recognizer(learned).recognize(Grammars.toks("a b a b")));
		assertFalse(new Recognizer(learned).recognize(Grammars.toks("a a")));
	}

	// the user accepts the first grammar that derives a
	@Test
	public void interactive() throws Exception {
		String out = run(new String[] { "-i", "--states", "S" }, "a\n\n");
		assertEquals("S\nS -> S S\nS -> a\n", out.substring(0, out.indexOf('%')));
	}

	private static void badConfig(String... argv) throws Exception {
		try {
			CFGLearn.processParameters(new JSAP(), argv);
		}
		catch (ConfigureException e) {
			return;
		}
		throw new AssertionError("accepted bad options");
	}

	@Test
	public void illegalCombinations() throws Exception {
		badConfig("-k", "3", "-c", "g.cfg");
		badConfig("-l", "-i", "--states", "S");
		badConfig("-d", "-k", "3", "g.cfg");
		badConfig("--states", "S A", "g.cfg", "s.txt");
		badConfig("-i");
		badConfig("-v", "g.cfg", "s.txt");
		badConfig("-c", "g.cfg", "s.txt");
		badConfig("g.cfg");
		badConfig("-l", "--samples", "0", "g.cfg", "s.txt");
	}

	@Test
	public void typedOptions() throws Exception {
		JSAPResult config = CFGLearn.processParameters(new JSAP(), new String[] {
				"-l", "--samples", "12", "--max-iterations", "40", "-e", "latin1", "g.cfg", "s.txt" });
		assertTrue(config.success());
		assertEquals(12, config.getInt("samples"));
		assertEquals(40, config.getInt("maxiter"));
		assertEquals("latin1", config.getString("encoding"));
		File[] files = config.getFileArray("infiles");
		assertEquals(2, files.length);
		assertEquals("s.txt", files[1].getName());
	}

	@Test
	public void help() throws Exception {
		JSAPResult config = CFGLearn.processParameters(new JSAP(), new String[] { "-h" });
		assertTrue(config.getBoolean("help"));
	}
}
