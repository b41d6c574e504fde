package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Simulated counterexamples. A hypothesis is wrong if it misses a string of the
 * positive corpus, or if one of the first n strings of its language (shortest
 * first) is rejected by the target.
 */
public class SampleCounterExampleOracle implements CounterExampleOracle {
	private MembershipOracle target;
	private Symbol start;
	private ArrayList<List<Symbol>> corpus;
	private int samples;

	public SampleCounterExampleOracle(MembershipOracle target, Symbol start, List<List<Symbol>> corpus, int samples) {
		this.target = target;
		this.start = start;
		this.corpus = new ArrayList<List<Symbol>>(corpus);
		this.samples = samples;
	}

	public List<Symbol> findCounterExample(CFGRuleSet hypothesis) {
		boolean debug = false;
		Recognizer r = new Recognizer(hypothesis);
		for (List<Symbol> pos : corpus) {
			if (!r.recognize(pos)) {
				if (debug) Debug.debug(debug, "Hypothesis misses "+SymbolFactory.toYield(pos));
				return pos;
			}
		}
		Iterator<List<Symbol>> lang = r.language();
		for (int i = 0; i < samples && lang.hasNext(); i++) {
			List<Symbol> str = lang.next();
			if (!target.isMember(start, str)) {
				if (debug) Debug.debug(debug, "Hypothesis overgenerates "+SymbolFactory.toYield(str));
				return str;
			}
		}
		return null;
	}
}
