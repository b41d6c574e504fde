package edu.isi.cfglearn;

import java.util.List;

// membership answered by a known grammar, for any of its states
public class GrammarMembershipOracle implements MembershipOracle {
	private Recognizer target;

	public GrammarMembershipOracle(CFGRuleSet g) {
		target = new Recognizer(g);
	}

	public boolean isMember(Symbol state, List<Symbol> yield) {
		return target.recognize(state, yield);
	}
}
