package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Membership, derivation length, derivation trees, and language enumeration
 * for one grammar. Empty rules are handled by stepping over nullable states,
 * so trees still only use rules of the grammar given here.
 */
public class Recognizer {
	private CFGRuleSet grammar;
	private Nullability nullability;
	private CFGRuleSet nullFree;
	// for enumeration, built on first use
	private Recognizer pruned;

	public Recognizer(CFGRuleSet rs) {
		grammar = rs;
		nullability = new Nullability(rs);
		nullFree = nullability.getNullFree();
	}

	public CFGRuleSet getGrammar() {
		return grammar;
	}

	public Nullability getNullability() {
		return nullability;
	}

	// shift only the token actually at each position
	private static class TokenPredicate implements ShiftPredicate {
		private List<Symbol> toks;
		TokenPredicate(List<Symbol> t) {
			toks = t;
		}
		public boolean canShift(int index, Symbol sym) {
			return index < toks.size() && toks.get(index) == sym;
		}
	}

	// best goal item covering all of toks, or null
	private EarleyState parse(EarleyChart chart, List<Symbol> toks) {
		boolean debug = false;
		chart.run();
		for (int i = 0; i < toks.size(); i++) {
			if (!chart.advance()) {
				if (debug) Debug.debug(debug, "Chart died at "+i+" of "+SymbolFactory.toYield(toks));
				return null;
			}
			chart.run();
		}
		if (debug) Debug.debug(debug, "Built "+chart.getNumStates()+" items for "+SymbolFactory.toYield(toks));
		return chart.getGoalCompletions().get(toks);
	}

	private EarleyChart newChart(Symbol state, List<Symbol> toks) {
		return new EarleyChart(nullFree, nullability, state, new TokenPredicate(toks));
	}

	public boolean recognize(List<Symbol> toks) {
		return recognize(grammar.getStartState(), toks);
	}

	// does state derive exactly toks
	public boolean recognize(Symbol state, List<Symbol> toks) {
		return parse(newChart(state, toks), toks) != null;
	}

	// fewest rule applications taking the start state to toks, or null if there are none
	public Integer getDerivationLength(List<Symbol> toks) {
		return getDerivationLength(grammar.getStartState(), toks);
	}

	public Integer getDerivationLength(Symbol state, List<Symbol> toks) {
		EarleyState goal = parse(newChart(state, toks), toks);
		if (goal == null)
			return null;
		// the synthetic goal rule isn't a step
		return goal.getDerivLen()-1;
	}

	// one derivation of toks from state, or null
	public DerivationTree derive(Symbol state, List<Symbol> toks) {
		EarleyChart chart = newChart(state, toks);
		EarleyState goal = parse(chart, toks);
		if (goal == null)
			return null;
		return buildTree(chart, goal).getChildren().get(0);
	}

	public DerivationTree derive(List<Symbol> toks) {
		return derive(grammar.getStartState(), toks);
	}

	// follow backlinks from a completed item to the fresh prediction it came from
	private DerivationTree buildTree(EarleyChart chart, EarleyState done) {
		ArrayList<EarleyState> steps = new ArrayList<EarleyState>();
		EarleyState cur = done;
		while (cur.getRulePos() > 0) {
			steps.add(cur);
			cur = chart.getState(cur.getPrev());
		}
		Collections.reverse(steps);
		ArrayList<DerivationTree> kids = new ArrayList<DerivationTree>();
		for (EarleyState step : steps) {
			EarleyState prev = chart.getState(step.getPrev());
			int childStart = prev.getStart()+prev.getToks().size();
			if (step.getChild() == EarleyState.NULLED)
				kids.add(nullability.getEmptyDerivation(prev.getNextSymbol(), childStart));
			else if (step.getChild() >= 0)
				kids.add(buildTree(chart, chart.getState(step.getChild())));
		}
		return new DerivationTree(done.getRule(), done.getStart(), done.getToks(), kids);
	}

	/**
	 * Every string of the start state, in the order the chart completes them:
	 * all strings of length n come before any of length n+1. Each call starts
	 * over. The iterator ends only if the language is finite.
	 */
	public Iterator<List<Symbol>> language() {
		if (pruned == null)
			pruned = new Recognizer(grammar.getPruned());
		return new LanguageIterator(new EarleyChart(pruned.nullFree, pruned.nullability,
				grammar.getStartState(), LanguageIterator.ALWAYS));
	}
}
