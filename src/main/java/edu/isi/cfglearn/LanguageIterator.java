package edu.isi.cfglearn;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

// lazily pulls strings out of a chart that shifts every terminal it meets.
// the grammar should be pruned: then a chart that still has items has more strings to give
public class LanguageIterator implements Iterator<List<Symbol>> {
	static final ShiftPredicate ALWAYS = new ShiftPredicate() {
		public boolean canShift(int index, Symbol sym) {
			return true;
		}
	};

	private EarleyChart chart;
	private boolean started;
	private ArrayDeque<List<Symbol>> pending;

	LanguageIterator(EarleyChart c) {
		chart = c;
		started = false;
		pending = new ArrayDeque<List<Symbol>>();
	}

	public boolean hasNext() {
		boolean debug = false;
		while (pending.isEmpty()) {
			if (!started)
				started = true;
			else if (!chart.advance())
				return false;
			chart.run();
			pending.addAll(chart.getGoalCompletions().keySet());
			if (debug) Debug.debug(debug, pending.size()+" strings of length "+chart.getPosition());
		}
		return true;
	}

	public List<Symbol> next() {
		if (!hasNext())
			throw new NoSuchElementException("Language exhausted after length "+chart.getPosition());
		return pending.poll();
	}

	public void remove() {
		throw new UnsupportedOperationException("Can't remove from a language");
	}
}
