package edu.isi.cfglearn;
// interned token identity. a symbol is either a terminal or a state (nonterminal)
// all creation goes through SymbolFactory, so equality is identity
public abstract class Symbol {
	abstract public String toString();
	abstract public boolean isTerminal();
	private static Symbol eps;
	private static Symbol goal;
	static {
		eps = SymbolFactory.getTerminal("*e*");
		goal = SymbolFactory.getState("*goal*");
	}
	// only meaningful in file syntax; never appears in a rule or a token sequence
	public static Symbol getEpsilon() {
		return eps;
	}
	// lhs of the synthetic top rule that seeds every chart
	public static Symbol getGoal() {
		return goal;
	}
	public boolean isState() {
		return !isTerminal();
	}
}
