package edu.isi.cfglearn;

import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Earley chart for one parse, run one position at a time. The grammar must be
 * null free; nullable states are stepped over directly when predicted.
 * <p>
 * The chart is seeded with <code>*goal* -&gt; state</code> at position 0. Items
 * waiting on a (start, state) reduction live for the whole parse. Completions
 * at the current position are kept per (start, state) and consumed terminals,
 * holding the item with the fewest derivation steps; they are cleared when the
 * chart advances.
 */
public class EarleyChart {
	private CFGRuleSet grammar;
	private Nullability nullability;
	private ShiftPredicate pred;
	private EarleyStateFactory factory;
	private CFGRule goalRule;

	private int position;
	private ArrayDeque<EarleyState> agenda;
	private ArrayDeque<EarleyState> nextAgenda;
	// best step count seen for each item at this position
	private HashMap<EarleyState.Key, Integer> processed;
	// states already predicted at this position
	private HashSet<Symbol> predicted;
	// start -> state -> items with that state after the dot
	private TIntObjectHashMap<HashMap<Symbol, ArrayList<EarleyState>>> waiting;
	// start -> state -> consumed terminals -> best completed item, ending here
	private TIntObjectHashMap<HashMap<Symbol, LinkedHashMap<List<Symbol>, EarleyState>>> completions;
	// ids already registered as waiters, so reprocessing doesn't duplicate them
	private TIntHashSet registered;

	public EarleyChart(CFGRuleSet nullFree, Nullability nul, Symbol state, ShiftPredicate sp) {
		grammar = nullFree;
		nullability = nul;
		pred = sp;
		factory = new EarleyStateFactory();
		goalRule = new CFGRule(Symbol.getGoal(), state);
		position = 0;
		agenda = new ArrayDeque<EarleyState>();
		nextAgenda = new ArrayDeque<EarleyState>();
		processed = new HashMap<EarleyState.Key, Integer>();
		predicted = new HashSet<Symbol>();
		waiting = new TIntObjectHashMap<HashMap<Symbol, ArrayList<EarleyState>>>();
		completions = new TIntObjectHashMap<HashMap<Symbol, LinkedHashMap<List<Symbol>, EarleyState>>>();
		registered = new TIntHashSet();
		agenda.add(factory.predict(goalRule, 0));
	}

	public int getPosition() {
		return position;
	}

	public EarleyState getState(int id) {
		return factory.getState(id);
	}

	public int getNumStates() {
		return factory.getCount();
	}

	// nothing was shifted past the current position
	public boolean isExhausted() {
		return nextAgenda.isEmpty();
	}

	// process everything at the current position
	public void run() {
		boolean debug = false;
		while (!agenda.isEmpty()) {
			EarleyState es = agenda.poll();
			EarleyState.Key k = es.getKey();
			Integer best = processed.get(k);
			if (best != null && best <= es.getDerivLen())
				continue;
			processed.put(k, es.getDerivLen());
			if (debug) Debug.debug(debug, position+": "+es);
			switch (es.getAction()) {
			case SHIFT:
				if (pred.canShift(position, es.getNextSymbol()))
					nextAgenda.add(factory.shift(es));
				break;
			case PREDICT:
				predict(es);
				break;
			case REDUCE:
				reduce(es);
				break;
			}
		}
	}

	// move to the next position. false if there's nothing there
	public boolean advance() {
		if (isExhausted())
			return false;
		position++;
		ArrayDeque<EarleyState> tmp = agenda;
		agenda = nextAgenda;
		nextAgenda = tmp;
		processed.clear();
		predicted.clear();
		completions.clear();
		return true;
	}

	private void predict(EarleyState es) {
		Symbol sym = es.getNextSymbol();
		if (!predicted.contains(sym)) {
			predicted.add(sym);
			for (CFGRule r : grammar.getRulesOfType(sym))
				agenda.add(factory.predict(r, position));
		}
		if (!registered.contains(es.getId())) {
			registered.add(es.getId());
			HashMap<Symbol, ArrayList<EarleyState>> bystate = waiting.get(position);
			if (bystate == null) {
				bystate = new HashMap<Symbol, ArrayList<EarleyState>>();
				waiting.put(position, bystate);
			}
			ArrayList<EarleyState> l = bystate.get(sym);
			if (l == null) {
				l = new ArrayList<EarleyState>();
				bystate.put(sym, l);
			}
			l.add(es);
		}
		if (nullability.isNullable(sym))
			agenda.add(factory.skipNullable(es, nullability.getEmptySteps(sym)));
	}

	private void reduce(EarleyState es) {
		Symbol lhs = es.getRule().getLHS();
		HashMap<Symbol, LinkedHashMap<List<Symbol>, EarleyState>> bystate = completions.get(es.getStart());
		if (bystate == null) {
			bystate = new HashMap<Symbol, LinkedHashMap<List<Symbol>, EarleyState>>();
			completions.put(es.getStart(), bystate);
		}
		LinkedHashMap<List<Symbol>, EarleyState> bytoks = bystate.get(lhs);
		if (bytoks == null) {
			bytoks = new LinkedHashMap<List<Symbol>, EarleyState>();
			bystate.put(lhs, bytoks);
		}
		EarleyState old = bytoks.get(es.getToks());
		if (old != null && old.getDerivLen() <= es.getDerivLen())
			return;
		bytoks.put(es.getToks(), es);
		HashMap<Symbol, ArrayList<EarleyState>> waitstates = waiting.get(es.getStart());
		if (waitstates == null || !waitstates.containsKey(lhs))
			return;
		for (EarleyState w : waitstates.get(lhs))
			agenda.add(factory.complete(w, es));
	}

	// completed items for (start, state) ending at the current position, in discovery order
	public LinkedHashMap<List<Symbol>, EarleyState> getCompletions(int start, Symbol state) {
		HashMap<Symbol, LinkedHashMap<List<Symbol>, EarleyState>> bystate = completions.get(start);
		if (bystate == null || !bystate.containsKey(state))
			return new LinkedHashMap<List<Symbol>, EarleyState>();
		return bystate.get(state);
	}

	// whole-input completions of the seeded state
	public LinkedHashMap<List<Symbol>, EarleyState> getGoalCompletions() {
		return getCompletions(0, Symbol.getGoal());
	}
}
