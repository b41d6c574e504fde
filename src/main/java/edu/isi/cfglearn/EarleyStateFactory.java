package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/* holds every item created during one parse, indexed by id, so items
 * can point back at the items they were built from without holding them.
 * only used during parsing
 */
public class EarleyStateFactory {
	private ArrayList<EarleyState> states;
	private static final List<Symbol> EMPTY = Collections.emptyList();

	public EarleyStateFactory() {
		states = new ArrayList<EarleyState>();
	}

	public EarleyState getState(int id) {
		return states.get(id);
	}

	public int getCount() {
		return states.size();
	}

	private EarleyState make(CFGRule r, int rp, int start, int len, List<Symbol> toks, int prev, int child) {
		EarleyState es = new EarleyState(states.size(), r, rp, start, len, toks, prev, child);
		states.add(es);
		return es;
	}

	// fresh item with the dot at the beginning. one step for applying r
	public EarleyState predict(CFGRule r, int pos) {
		return make(r, 0, pos, 1, EMPTY, -1, -1);
	}

	// move over the terminal after the dot
	public EarleyState shift(EarleyState es) {
		List<Symbol> one = Collections.singletonList(es.getNextSymbol());
		return make(es.getRule(), es.getRulePos()+1, es.getStart(), es.getDerivLen(),
				EarleyState.append(es.getToks(), one), es.getId(), EarleyState.SHIFTED);
	}

	// move over a nullable state without consuming anything
	public EarleyState skipNullable(EarleyState es, int emptySteps) {
		return make(es.getRule(), es.getRulePos()+1, es.getStart(), es.getDerivLen()+emptySteps,
				es.getToks(), es.getId(), EarleyState.NULLED);
	}

	// move a waiting item over a completed child
	public EarleyState complete(EarleyState waiter, EarleyState done) {
		return make(waiter.getRule(), waiter.getRulePos()+1, waiter.getStart(), waiter.getDerivLen()+done.getDerivLen(),
				EarleyState.append(waiter.getToks(), done.getToks()), waiter.getId(), done.getId());
	}
}
