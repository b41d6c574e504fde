package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Set;

// which states can derive the empty sequence, and how.
// the chart runs on the null free grammar and steps over nullable states itself
public class Nullability {
	private CFGRuleSet grammar;
	// fewest rule applications needed to derive the empty sequence
	private HashMap<Symbol, Integer> emptySteps;
	// rule that achieves emptySteps
	private HashMap<Symbol, CFGRule> witness;

	public Nullability(CFGRuleSet rs) {
		boolean debug = false;
		grammar = rs;
		emptySteps = new HashMap<Symbol, Integer>();
		witness = new HashMap<Symbol, CFGRule>();
		// like getEpsStates, but keep the cheapest rule, so keep going until nothing improves
		boolean changed = true;
		while (changed) {
			changed = false;
			for (CFGRule r : rs.getRules()) {
				int cost = 1;
				boolean isOkay = true;
				for (Symbol s : r.getRHS()) {
					Integer sub = emptySteps.get(s);
					if (s.isTerminal() || sub == null) {
						isOkay = false;
						break;
					}
					cost += sub;
				}
				if (!isOkay)
					continue;
				Integer old = emptySteps.get(r.getLHS());
				if (old == null || cost < old) {
					if (debug) Debug.debug(debug, r.getLHS()+" nullable in "+cost+" via "+r);
					emptySteps.put(r.getLHS(), cost);
					witness.put(r.getLHS(), r);
					changed = true;
				}
			}
		}
	}

	public boolean isNullable(Symbol s) {
		return emptySteps.containsKey(s);
	}

	public Set<Symbol> getNullableStates() {
		return emptySteps.keySet();
	}

	// fewest steps for s =>* *e*; only defined for nullable states
	public int getEmptySteps(Symbol s) {
		return emptySteps.get(s);
	}

	// same grammar minus its empty rules
	public CFGRuleSet getNullFree() {
		CFGRuleSet ret = new CFGRuleSet(grammar.getStartState(), grammar.getStates());
		for (CFGRule r : grammar.getRules())
			if (!r.isEpsilon())
				ret.addRule(r);
		return ret;
	}

	// s =>* *e* at position pos, using the rules that made s nullable.
	// each witness child has strictly fewer steps than its parent so this bottoms out
	public DerivationTree getEmptyDerivation(Symbol s, int pos) {
		CFGRule r = witness.get(s);
		if (r == null)
			return null;
		ArrayList<DerivationTree> kids = new ArrayList<DerivationTree>();
		for (Symbol c : r.getRHS())
			kids.add(getEmptyDerivation(c, pos));
		return new DerivationTree(r, pos, new ArrayList<Symbol>(), kids);
	}
}
