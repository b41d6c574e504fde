package edu.isi.cfglearn;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// a single production: state -> sequence of symbols. the rhs may be empty.
// immutable, so rules can be shared between rule sets and used as map keys
public class CFGRule {
	private Symbol lhs;
	private Symbol[] rhs;
	private int hsh;

	public CFGRule(Symbol lhs, List<Symbol> rhs) {
		this(lhs, rhs.toArray(new Symbol[rhs.size()]));
	}

	public CFGRule(Symbol lhs, Symbol... rhs) {
		this.lhs = lhs;
		this.rhs = rhs.clone();
		hsh = 31*lhs.hashCode()+Arrays.hashCode(this.rhs);
	}

	// lhs -> rhs, where the rhs is a space separated sequence or *e*
	private static Pattern rulePat = Pattern.compile("\\s*(\\S+)\\s*->\\s*(.*?)\\s*");

	// just the lhs name, so a reader can learn every state before parsing any rhs
	static String parseLHS(String text) throws DataFormatException {
		Matcher m = rulePat.matcher(text);
		if (!m.matches())
			throw new DataFormatException("Expected lhs -> rhs");
		return m.group(1);
	}

	// parse the text of a rule. stateNames decides which rhs tokens are states
	static CFGRule parse(String text, Set<String> stateNames) throws DataFormatException {
		Matcher m = rulePat.matcher(text);
		if (!m.matches())
			throw new DataFormatException("Expected lhs -> rhs");
		Symbol l = SymbolFactory.getState(m.group(1));
		String body = m.group(2);
		if (body.length() == 0)
			throw new DataFormatException("Empty right side; use "+Symbol.getEpsilon()+" for the empty sequence");
		if (body.equals(Symbol.getEpsilon().toString()))
			return new CFGRule(l);
		String[] toks = body.split("\\s+");
		Symbol[] r = new Symbol[toks.length];
		for (int i = 0; i < toks.length; i++) {
			if (toks[i].equals(Symbol.getEpsilon().toString()))
				throw new DataFormatException(Symbol.getEpsilon()+" must stand alone on the right side");
			if (toks[i].equals("->"))
				throw new DataFormatException("More than one -> in rule");
			if (stateNames.contains(toks[i]))
				r[i] = SymbolFactory.getState(toks[i]);
			else
				r[i] = SymbolFactory.getTerminal(toks[i]);
		}
		return new CFGRule(l, r);
	}

	public Symbol getLHS() { return lhs; }
	public List<Symbol> getRHS() { return Collections.unmodifiableList(Arrays.asList(rhs)); }
	public Symbol getRHS(int i) { return rhs[i]; }
	public int size() { return rhs.length; }

	public boolean isEpsilon() {
		return rhs.length == 0;
	}
	// CNF leaf: A -> a
	public boolean isLeaf() {
		return rhs.length == 1 && rhs[0].isTerminal();
	}
	// CNF branch: A -> B C
	public boolean isBranch() {
		return rhs.length == 2 && rhs[0].isState() && rhs[1].isState();
	}

	public int hashCode() { return hsh; }
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof CFGRule))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs == r.lhs && Arrays.equals(rhs, r.rhs);
	}

	public String toString() {
		StringBuffer sb = new StringBuffer(lhs.toString());
		sb.append(" ->");
		if (rhs.length == 0)
			sb.append(" ").append(Symbol.getEpsilon().toString());
		for (Symbol s : rhs)
			sb.append(" ").append(s.toString());
		return sb.toString();
	}
}
