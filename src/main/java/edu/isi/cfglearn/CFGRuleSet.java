package edu.isi.cfglearn;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.Stack;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A context-free grammar: a start state and, for each state, its rules in the
 * order they were added. States may be declared without any rules.
 * <p>
 * File format: the first non-comment line holds the start state; every
 * following non-comment line is a rule <code>lhs -&gt; sym sym ...</code>, with
 * <code>*e*</code> as the empty right side. <code>%</code> begins a comment.
 * A symbol is a state if it appears on some left side or is the start state;
 * everything else is a terminal.
 */
public class CFGRuleSet {
	private Symbol startState;
	private LinkedHashSet<Symbol> states;
	private LinkedHashMap<Symbol, ArrayList<CFGRule>> rulesByLHS;
	private int numRules;

	public CFGRuleSet(Symbol start) {
		startState = start;
		states = new LinkedHashSet<Symbol>();
		rulesByLHS = new LinkedHashMap<Symbol, ArrayList<CFGRule>>();
		numRules = 0;
		addState(start);
	}

	public CFGRuleSet(Symbol start, Collection<Symbol> stateSet) {
		this(start);
		for (Symbol s : stateSet)
			addState(s);
	}

	// copy. rules are immutable so they are shared
	public CFGRuleSet(CFGRuleSet other) {
		this(other.startState, other.states);
		for (CFGRule r : other.getRules())
			addRule(r);
	}

	public CFGRuleSet(String filename, String encoding) throws FileNotFoundException, IOException, DataFormatException  {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");

	// something that can be a start state -- no spaces
	// can be followed by whitespace and comment
	private static Pattern startStatePat = Pattern.compile("\\s*(\\S+)\\s*(%.*)?");

	// strip comments off
	private static Pattern commentStripPat = Pattern.compile("\\s*(.*?[^\\s%])(\\s*(?:%.*)?)?");

	public CFGRuleSet(BufferedReader br) throws IOException, DataFormatException {
		this((Symbol)null);
		boolean debug = false;
		String line = br.readLine();
		int lineno = 1;
		// 1) ignore all comments fields and blank lines in the header
		while (line != null && commentPat.matcher(line).matches()) {
			if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
			line = br.readLine();
			lineno++;
		}
		if (line == null)
			throw new DataFormatException("No start state found");

		// 2) get start state
		Matcher startStateMatch = startStatePat.matcher(line);
		if (!startStateMatch.matches())
			throw new DataFormatException("Line "+lineno+": could not find start state in "+line);
		String startName = startStateMatch.group(1);
		if (startName.equals(Symbol.getEpsilon().toString()) || startName.contains("->"))
			throw new DataFormatException("Line "+lineno+": "+startName+" cannot be a start state");

		// 3) collect rule text. states aren't known until every lhs has been seen
		ArrayList<String> ruleText = new ArrayList<String>();
		ArrayList<Integer> ruleLines = new ArrayList<Integer>();
		HashSet<String> stateNames = new HashSet<String>();
		stateNames.add(startName);
		while ((line = br.readLine()) != null) {
			lineno++;
			if (commentPat.matcher(line).matches())
				continue;
			Matcher commentStripMatch = commentStripPat.matcher(line);
			if (!commentStripMatch.matches())
				throw new DataFormatException("Line "+lineno+": couldn't strip comments off of "+line);
			String text = commentStripMatch.group(1);
			try {
				stateNames.add(CFGRule.parseLHS(text));
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+lineno+": "+text+", "+e.getMessage(), e);
			}
			ruleText.add(text);
			ruleLines.add(lineno);
		}
		br.close();

		startState = SymbolFactory.getState(startName);
		addState(startState);
		for (int i = 0; i < ruleText.size(); i++) {
			CFGRule r = null;
			try {
				r = CFGRule.parse(ruleText.get(i), stateNames);
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+ruleLines.get(i)+": "+ruleText.get(i)+", "+e.getMessage(), e);
			}
			if (debug) Debug.debug(debug, "Made rule "+r.toString());
			addRule(r);
		}
	}

	// convenience for grammars written inline
	public static CFGRuleSet fromString(String text) throws DataFormatException {
		try {
			return new CFGRuleSet(new BufferedReader(new StringReader(text)));
		}
		catch (IOException e) {
			throw new DataFormatException("Couldn't read grammar text: "+e.getMessage(), e);
		}
	}

	public Symbol getStartState() {
		return startState;
	}

	public void addState(Symbol s) {
		if (s == null)
			return;
		states.add(s);
	}

	public Set<Symbol> getStates() {
		return states;
	}

	// false if the rule was already present
	public boolean addRule(CFGRule r) {
		ArrayList<CFGRule> l = rulesByLHS.get(r.getLHS());
		if (l == null) {
			l = new ArrayList<CFGRule>();
			rulesByLHS.put(r.getLHS(), l);
		}
		else if (l.contains(r))
			return false;
		addState(r.getLHS());
		l.add(r);
		numRules++;
		return true;
	}

	public boolean removeRule(CFGRule r) {
		ArrayList<CFGRule> l = rulesByLHS.get(r.getLHS());
		if (l == null || !l.remove(r))
			return false;
		numRules--;
		return true;
	}

	public boolean hasRule(CFGRule r) {
		ArrayList<CFGRule> l = rulesByLHS.get(r.getLHS());
		return l != null && l.contains(r);
	}

	// rules with s on the lhs. empty (never null) if there are none
	public ArrayList<CFGRule> getRulesOfType(Symbol s) {
		ArrayList<CFGRule> l = rulesByLHS.get(s);
		if (l == null)
			return new ArrayList<CFGRule>();
		return l;
	}

	// all rules, start state's first, then in order of first appearance of each lhs
	public ArrayList<CFGRule> getRules() {
		ArrayList<CFGRule> ret = new ArrayList<CFGRule>(numRules);
		ret.addAll(getRulesOfType(startState));
		for (Symbol s : rulesByLHS.keySet()) {
			if (s == startState)
				continue;
			ret.addAll(rulesByLHS.get(s));
		}
		return ret;
	}

	public int getNumRules() {
		return numRules;
	}

	public Set<Symbol> getTerminals() {
		LinkedHashSet<Symbol> ret = new LinkedHashSet<Symbol>();
		for (CFGRule r : getRules())
			for (Symbol s : r.getRHS())
				if (s.isTerminal())
					ret.add(s);
		return ret;
	}

	// every rule is a leaf or a branch
	public boolean isCNF() {
		for (CFGRule r : getRules())
			if (!r.isLeaf() && !r.isBranch())
				return false;
		return true;
	}

	/**
	 * Remove useless rules. Phase 1 finds the productive states bottom up;
	 * phase 2 walks down from the start state through rules whose right-side
	 * states are all productive. The result keeps the original rule order,
	 * so pruning a pruned grammar gives back an equal grammar.
	 */
	public CFGRuleSet getPruned() {
		boolean debug = false;
		HashSet<Symbol> bottomReachable = new HashSet<Symbol>();
		// phase 1: bottom up
		int brSize = 0;
		do {
			brSize = bottomReachable.size();
			for (Symbol currState : rulesByLHS.keySet()) {
				if (bottomReachable.contains(currState))
					continue;
				for (CFGRule currRule : rulesByLHS.get(currState)) {
					if (allStatesIn(currRule, bottomReachable)) {
						if (debug) Debug.debug(debug, "BU: "+currState+" thanks to "+currRule);
						bottomReachable.add(currState);
						break;
					}
				}
			}
			if (debug) Debug.debug(debug, "Gone from "+brSize+" to "+bottomReachable.size());
		} while (brSize < bottomReachable.size());

		// phase 2: top down
		HashSet<CFGRule> keptRules = new HashSet<CFGRule>();
		HashSet<Symbol> checkedStates = new HashSet<Symbol>();
		Stack<Symbol> readyStates = new Stack<Symbol>();
		if (bottomReachable.contains(startState)) {
			readyStates.push(startState);
			checkedStates.add(startState);
		}
		while (readyStates.size() > 0) {
			Symbol currState = readyStates.pop();
			for (CFGRule currRule : getRulesOfType(currState)) {
				if (!allStatesIn(currRule, bottomReachable))
					continue;
				keptRules.add(currRule);
				for (Symbol s : currRule.getRHS()) {
					if (s.isState() && !checkedStates.contains(s)) {
						checkedStates.add(s);
						readyStates.push(s);
					}
				}
			}
		}
		CFGRuleSet ret = new CFGRuleSet(startState);
		for (CFGRule r : getRules())
			if (keptRules.contains(r))
				ret.addRule(r);
		if (debug) Debug.debug(debug, "Pruned "+numRules+" rules to "+ret.getNumRules());
		return ret;
	}

	private static boolean allStatesIn(CFGRule r, Set<Symbol> okay) {
		for (Symbol s : r.getRHS())
			if (s.isState() && !okay.contains(s))
				return false;
		return true;
	}

	public boolean equals(Object o) {
		if (!(o instanceof CFGRuleSet))
			return false;
		CFGRuleSet other = (CFGRuleSet)o;
		if (startState != other.startState || numRules != other.numRules)
			return false;
		return new HashSet<CFGRule>(getRules()).equals(new HashSet<CFGRule>(other.getRules()));
	}

	public int hashCode() {
		return 31*startState.hashCode()+new HashSet<CFGRule>(getRules()).hashCode();
	}

	public String toString() {
		StringBuffer l = new StringBuffer(startState.toString()+"\n");
		for (CFGRule r : getRules())
			l.append(r.toString()).append("\n");
		return l.toString();
	}

	// print in the format the reader accepts
	public void print(Writer w) throws IOException {
		w.write(toString());
		w.flush();
	}
}
