package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

// remembers every answer, so each question reaches the wrapped oracle at most once
public class CachingMembershipOracle implements MembershipOracle {
	private MembershipOracle oracle;
	private HashMap<Symbol, HashMap<List<Symbol>, Boolean>> cache;
	private int hits;

	public CachingMembershipOracle(MembershipOracle o) {
		oracle = o;
		cache = new HashMap<Symbol, HashMap<List<Symbol>, Boolean>>();
		hits = 0;
	}

	public boolean isMember(Symbol state, List<Symbol> yield) {
		HashMap<List<Symbol>, Boolean> bystate = cache.get(state);
		if (bystate == null) {
			bystate = new HashMap<List<Symbol>, Boolean>();
			cache.put(state, bystate);
		}
		Boolean ans = bystate.get(yield);
		if (ans != null) {
			hits++;
			return ans;
		}
		ans = oracle.isMember(state, yield);
		// key on a private copy; callers may reuse their lists
		bystate.put(new ArrayList<Symbol>(yield), ans);
		return ans;
	}

	public int getHits() {
		return hits;
	}
}
