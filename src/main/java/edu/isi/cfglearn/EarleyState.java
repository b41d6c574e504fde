package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// dotted rule in the chart. should only be constructed through EarleyStateFactory
public class EarleyState {
	public enum Action { SHIFT, PREDICT, REDUCE }

	// what moved the dot, when it wasn't a completed child
	public static final int SHIFTED = -1;
	public static final int NULLED = -2;

	// identity for the duplicate check: derivLen and backlinks aren't part of it
	static class Key {
		private CFGRule rule;
		private int start;
		private int rulepos;
		private List<Symbol> toks;
		private int hsh;
		Key(CFGRule r, int s, int rp, List<Symbol> t) {
			rule = r;
			start = s;
			rulepos = rp;
			toks = t;
			hsh = ((rule.hashCode()*31+start)*31+rulepos)*31+toks.hashCode();
		}
		public int hashCode() { return hsh; }
		public boolean equals(Object o) {
			if (!(o instanceof Key))
				return false;
			Key k = (Key)o;
			return start == k.start && rulepos == k.rulepos && rule.equals(k.rule) && toks.equals(k.toks);
		}
	}

	private CFGRule rule;
	private int rulepos;
	private int start;
	private int derivLen;
	private List<Symbol> toks;
	private Action action;
	private int id;
	// item this one was advanced from, or -1 for a fresh prediction
	private int prev;
	// completed child id, SHIFTED, or NULLED
	private int child;

	EarleyState(int id, CFGRule rule, int rulepos, int start, int derivLen, List<Symbol> toks, int prev, int child) {
		this.id = id;
		this.rule = rule;
		this.rulepos = rulepos;
		this.start = start;
		this.derivLen = derivLen;
		this.toks = toks;
		this.prev = prev;
		this.child = child;
		if (rulepos == rule.size())
			action = Action.REDUCE;
		else if (rule.getRHS(rulepos).isTerminal())
			action = Action.SHIFT;
		else
			action = Action.PREDICT;
	}

	public int getId() { return id; }
	public CFGRule getRule() { return rule; }
	public int getRulePos() { return rulepos; }
	public int getStart() { return start; }
	public int getDerivLen() { return derivLen; }
	public List<Symbol> getToks() { return toks; }
	public Action getAction() { return action; }
	public int getPrev() { return prev; }
	public int getChild() { return child; }

	// symbol after the dot; null once complete
	public Symbol getNextSymbol() {
		if (action == Action.REDUCE)
			return null;
		return rule.getRHS(rulepos);
	}

	Key getKey() {
		return new Key(rule, start, rulepos, toks);
	}

	// toks plus more, as a fresh unmodifiable list
	static List<Symbol> append(List<Symbol> toks, List<Symbol> more) {
		ArrayList<Symbol> ret = new ArrayList<Symbol>(toks.size()+more.size());
		ret.addAll(toks);
		ret.addAll(more);
		return Collections.unmodifiableList(ret);
	}

	public String toString() {
		StringBuffer sb = new StringBuffer("["+id+"] "+rule.getLHS()+" ->");
		for (int i = 0; i < rule.size(); i++) {
			if (i == rulepos)
				sb.append(" .");
			sb.append(" ").append(rule.getRHS(i));
		}
		if (rulepos == rule.size())
			sb.append(" .");
		sb.append(" @"+start+" : "+SymbolFactory.toYield(toks)+" ("+derivLen+")");
		return sb.toString();
	}
}
