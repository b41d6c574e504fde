package edu.isi.cfglearn;

// a token that can appear in a recognized string. never rewritten
public class TerminalSymbol extends Symbol {
	private String intern;
	private int hsh;
	TerminalSymbol(String s) {
		intern = s.intern();
		hsh = intern.hashCode();
	}
	public String toString() { return intern; }
	public boolean isTerminal() { return true; }
	public int hashCode() { return hsh; }
	// prevent any slow comparisons
	public boolean equals(Object o) {
		return this == o;
	}
}
