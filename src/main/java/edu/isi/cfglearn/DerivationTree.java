package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One concrete derivation: the rule applied at the root, the span
 * [start, end) of the input it covers, the yield, and one child tree
 * for each state on the rule's right side, in order.
 */
public class DerivationTree {
	private CFGRule rule;
	private int start;
	private int end;
	private List<Symbol> yield;
	private ArrayList<DerivationTree> children;

	public DerivationTree(CFGRule rule, int start, List<Symbol> yield, List<DerivationTree> children) {
		this.rule = rule;
		this.start = start;
		this.end = start+yield.size();
		this.yield = Collections.unmodifiableList(new ArrayList<Symbol>(yield));
		this.children = new ArrayList<DerivationTree>(children);
	}

	public CFGRule getRule() { return rule; }
	public Symbol getLabel() { return rule.getLHS(); }
	public int getStart() { return start; }
	public int getEnd() { return end; }
	public List<Symbol> getYield() { return yield; }
	public List<DerivationTree> getChildren() { return Collections.unmodifiableList(children); }

	// number of rule applications in this tree
	public int getNumSteps() {
		int ret = 1;
		for (DerivationTree c : children)
			ret += c.getNumSteps();
		return ret;
	}

	// all rules used, top down, left to right
	public List<CFGRule> getRules() {
		ArrayList<CFGRule> ret = new ArrayList<CFGRule>();
		ret.add(rule);
		for (DerivationTree c : children)
			ret.addAll(c.getRules());
		return ret;
	}

	// S(A(a) B(b)). terminals print in place, an empty rule prints as S(*e*)
	public String toString() {
		StringBuffer sb = new StringBuffer(rule.getLHS().toString());
		sb.append("(");
		if (rule.isEpsilon())
			sb.append(Symbol.getEpsilon().toString());
		int nextChild = 0;
		for (int i = 0; i < rule.size(); i++) {
			if (i > 0)
				sb.append(" ");
			Symbol s = rule.getRHS(i);
			if (s.isState())
				sb.append(children.get(nextChild++).toString());
			else
				sb.append(s.toString());
		}
		sb.append(")");
		return sb.toString();
	}
}
