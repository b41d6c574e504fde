package edu.isi.cfglearn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Pattern;

// manages hashmaps of strings -> symbols. terminals and states live in separate tables,
// so "A" the terminal and "A" the state are different symbols
public class SymbolFactory {
	static private HashMap<String, Symbol> str2Term;
	static private HashMap<String, Symbol> str2State;
	static {
		str2Term = new HashMap<String, Symbol>();
		str2State = new HashMap<String, Symbol>();
	}

	private static Pattern spacePat = Pattern.compile("\\s+");

	static public Symbol getTerminal(String str) {
		boolean debug = false;
		Symbol sym = str2Term.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new terminal from "+str);
			sym = new TerminalSymbol(str);
			// constructing the first symbol initializes Symbol, which may have interned str already
			if (str2Term.containsKey(str))
				return str2Term.get(str);
			str2Term.put(str, sym);
		}
		return sym;
	}

	static public Symbol getState(String str) {
		boolean debug = false;
		Symbol sym = str2State.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new state from "+str);
			sym = new StateSymbol(str);
			// constructing the first symbol initializes Symbol, which may have interned str already
			if (str2State.containsKey(str))
				return str2State.get(str);
			str2State.put(str, sym);
		}
		return sym;
	}

	// a line of whitespace-separated tokens, as a token sequence.
	// a blank line or the single token *e* is the empty sequence
	static public List<Symbol> getTerminals(String line) {
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		String trimmed = line.trim();
		if (trimmed.length() == 0 || trimmed.equals(Symbol.getEpsilon().toString()))
			return ret;
		for (String tok : spacePat.split(trimmed))
			ret.add(getTerminal(tok));
		return ret;
	}

	// space-separated state names, in order, without repeats
	static public List<Symbol> getStates(String line) {
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		String trimmed = line.trim();
		if (trimmed.length() == 0)
			return ret;
		for (String tok : spacePat.split(trimmed)) {
			Symbol s = getState(tok);
			if (!ret.contains(s))
				ret.add(s);
		}
		return ret;
	}

	// inverse of getTerminals
	static public String toYield(List<Symbol> toks) {
		if (toks.isEmpty())
			return Symbol.getEpsilon().toString();
		StringBuffer sb = new StringBuffer();
		for (Symbol s : toks) {
			if (sb.length() > 0)
				sb.append(" ");
			sb.append(s.toString());
		}
		return sb.toString();
	}
}
