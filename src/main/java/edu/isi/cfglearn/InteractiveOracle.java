package edu.isi.cfglearn;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

// the user answers both kinds of question on the console
public class InteractiveOracle implements MembershipOracle, CounterExampleOracle {
	private BufferedReader in;
	private PrintStream out;

	public InteractiveOracle(BufferedReader in, PrintStream out) {
		this.in = in;
		this.out = out;
	}

	// end of input counts as a blank line
	private String readLine() {
		try {
			String line = in.readLine();
			return line == null ? "" : line;
		}
		catch (IOException e) {
			throw new IllegalStateException("Couldn't read answer: "+e.getMessage(), e);
		}
	}

	public List<Symbol> findCounterExample(CFGRuleSet hypothesis) {
		out.println("Correct?");
		out.println(hypothesis.toString());
		out.print("Blank for yes, Counter-example for no: ");
		out.flush();
		String line = readLine();
		out.println();
		if (line.trim().length() == 0)
			return null;
		return SymbolFactory.getTerminals(line);
	}

	public boolean isMember(Symbol state, List<Symbol> yield) {
		out.print(state+" =>* "+SymbolFactory.toYield(yield)+"? Y/N: ");
		out.flush();
		String line = readLine().trim();
		return line.length() > 0 && (line.charAt(0) == 'y' || line.charAt(0) == 'Y');
	}
}
