package edu.isi.cfglearn;

import java.util.List;

/** Answers whether a state of the target grammar derives a token sequence. */
public interface MembershipOracle {
	public boolean isMember(Symbol state, List<Symbol> yield);
}
