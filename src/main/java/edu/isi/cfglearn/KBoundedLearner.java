package edu.isi.cfglearn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Learns a CNF grammar over a fixed set of states from membership and
 * counterexample queries.
 * <p>
 * The working grammar starts with every branch rule over the states and no
 * leaves. Each round the pruned working grammar is offered to the
 * counterexample oracle. A counterexample the working grammar can't derive
 * adds a leaf rule for each of its terminals under each state, unless that
 * leaf is blacklisted. One it can derive is diagnosed: the bad rules of its
 * derivation tree are removed, and bad leaves are blacklisted for good.
 * <p>
 * A rule that the target also has is never blamed, so against consistent
 * oracles and a CNF target over the same states the working grammar only
 * shrinks after its leaves are in, and the loop ends.
 */
public class KBoundedLearner {
	private Symbol start;
	private ArrayList<Symbol> states;
	private MembershipOracle member;
	private CounterExampleOracle counter;
	private CFGRuleSet g;
	private LinkedHashSet<CFGRule> blacklist;
	private int iterations;
	private int maxIterations;

	public KBoundedLearner(Symbol start, Collection<Symbol> nts, MembershipOracle member, CounterExampleOracle counter) {
		this.start = start;
		states = new ArrayList<Symbol>(nts);
		if (!states.contains(start))
			states.add(0, start);
		this.member = new CachingMembershipOracle(member);
		this.counter = counter;
		blacklist = new LinkedHashSet<CFGRule>();
		iterations = 0;
		maxIterations = -1;
		g = initGrammar();
	}

	// every branch a -> b c, no leaves
	private CFGRuleSet initGrammar() {
		CFGRuleSet ret = new CFGRuleSet(start, states);
		for (Symbol a : states)
			for (Symbol b : states)
				for (Symbol c : states)
					ret.addRule(new CFGRule(a, b, c));
		return ret;
	}

	// negative means no cap
	public void setMaxIterations(int i) {
		maxIterations = i;
	}

	public int getIterations() {
		return iterations;
	}

	public Set<CFGRule> getBlacklist() {
		return Collections.unmodifiableSet(blacklist);
	}

	// unpruned
	public CFGRuleSet getWorkingGrammar() {
		return g;
	}

	public CFGRuleSet learn() throws UnusualConditionException {
		boolean debug = false;
		Date startTime = new Date();
		while (true) {
			if (maxIterations >= 0 && iterations >= maxIterations)
				throw new UnusualConditionException("No grammar accepted after "+iterations+" rounds; working grammar has "+g.getNumRules()+" rules");
			iterations++;
			CFGRuleSet pg = g.getPruned();
			List<Symbol> c = counter.findCounterExample(pg);
			if (c == null) {
				Debug.dbtime(1, startTime, "Learned "+pg.getNumRules()+" rules in "+iterations+" rounds");
				return pg;
			}
			if (debug) Debug.debug(debug, "Round "+iterations+": counterexample "+SymbolFactory.toYield(c));
			DerivationTree t = new Recognizer(g).derive(start, c);
			boolean changed = false;
			if (t != null) {
				if (debug) Debug.debug(debug, "Diagnosing "+t);
				for (CFGRule r : diagnose(t)) {
					if (debug) Debug.debug(debug, "Removing "+r);
					changed |= g.removeRule(r);
					if (r.isLeaf())
						blacklist.add(r);
				}
			}
			else {
				for (Symbol tok : c) {
					for (Symbol nt : states) {
						CFGRule leaf = new CFGRule(nt, tok);
						if (blacklist.contains(leaf))
							continue;
						if (g.addRule(leaf)) {
							if (debug) Debug.debug(debug, "Adding "+leaf);
							changed = true;
						}
					}
				}
			}
			// the same grammar would get the same answer forever
			if (!changed)
				throw new UnusualConditionException("Counterexample "+SymbolFactory.toYield(c)+" changes nothing; oracles disagree or target is not CNF over "+states);
		}
	}

	/**
	 * Bad rules in t, breadth first. A child is inconsistent if the
	 * membership oracle says its state can't derive its yield. A node with an
	 * inconsistent child passes the blame to the first such child; a node
	 * whose children are all fine has a bad rule itself.
	 */
	public Set<CFGRule> diagnose(DerivationTree t) {
		LinkedHashSet<CFGRule> bad = new LinkedHashSet<CFGRule>();
		ArrayDeque<DerivationTree> q = new ArrayDeque<DerivationTree>();
		q.add(t);
		while (!q.isEmpty()) {
			DerivationTree node = q.poll();
			DerivationTree badChild = null;
			for (DerivationTree child : node.getChildren()) {
				if (!member.isMember(child.getLabel(), child.getYield())) {
					badChild = child;
					break;
				}
			}
			if (badChild != null)
				q.add(badChild);
			else
				bad.add(node.getRule());
		}
		return bad;
	}
}
