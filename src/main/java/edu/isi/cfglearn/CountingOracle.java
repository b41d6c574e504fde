package edu.isi.cfglearn;

import java.util.List;

// counts the questions put to a pair of oracles, and optionally traces them
public class CountingOracle implements MembershipOracle, CounterExampleOracle {
	private MembershipOracle member;
	private CounterExampleOracle counter;
	private boolean verbose;
	private int memberCalls;
	private int counterCalls;

	public CountingOracle(MembershipOracle m, CounterExampleOracle c, boolean verbose) {
		member = m;
		counter = c;
		this.verbose = verbose;
		memberCalls = 0;
		counterCalls = 0;
	}

	public boolean isMember(Symbol state, List<Symbol> yield) {
		memberCalls++;
		boolean ans = member.isMember(state, yield);
		if (verbose) Debug.prettyDebug(state+" =>* "+SymbolFactory.toYield(yield)+"? "+(ans ? "yes" : "no"));
		return ans;
	}

	public List<Symbol> findCounterExample(CFGRuleSet hypothesis) {
		counterCalls++;
		List<Symbol> ans = counter.findCounterExample(hypothesis);
		if (verbose) {
			Debug.prettyDebug("Hypothesis "+counterCalls+" with "+hypothesis.getNumRules()+" rules:\n"+hypothesis);
			Debug.prettyDebug(ans == null ? "Accepted" : "Counterexample: "+SymbolFactory.toYield(ans));
		}
		return ans;
	}

	public int getMemberCalls() { return memberCalls; }
	public int getCounterCalls() { return counterCalls; }
}
