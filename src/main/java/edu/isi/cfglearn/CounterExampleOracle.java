package edu.isi.cfglearn;

import java.util.List;

/**
 * Judges a hypothesis grammar. Returns null if it is acceptable, otherwise a
 * string the hypothesis gets wrong: either one it should derive and doesn't,
 * or one it derives and shouldn't.
 */
public interface CounterExampleOracle {
	public List<Symbol> findCounterExample(CFGRuleSet hypothesis);
}
