package edu.isi.cfglearn;

// a nonterminal. called a state, as in the rest of the toolkit
public class StateSymbol extends Symbol {
	private String intern;
	private int hsh;
	StateSymbol(String s) {
		intern = s.intern();
		// keep states and terminals of the same name apart in hashed sets
		hsh = 31*intern.hashCode()+1;
	}
	public String toString() { return intern; }
	public boolean isTerminal() { return false; }
	public int hashCode() { return hsh; }
	public boolean equals(Object o) {
		return this == o;
	}
}
