package edu.isi.cfglearn;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line front end: recognize, enumerate, check, and learn grammars
public class CFGLearn {

	public static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// MODES. at most one of these

		FlaggedOption kopt = new FlaggedOption("enumerate",
				IntegerStringParser.getParser(),
				null,
				false,
				'k',
				"enumerate",
				"print the first <enumerate> strings of the grammar's language, shortest first. "+
		"Takes one grammar file. This option cannot be used with -c, -l or -i");
		jsap.registerParameter(kopt);

		Switch csw = new Switch("check",
				'c',
				"check",
				"print the states, rules, terminals and nullable states of the grammar, "+
		"and whether it is in Chomsky normal form. Takes one grammar file");
		jsap.registerParameter(csw);

		Switch lsw = new Switch("learn",
				'l',
				"learn",
				"learn a grammar over the states of a target CNF grammar, with the target answering "+
				"membership queries and sampled strings checking hypotheses. Takes the target grammar "+
		"file then a file of positive example strings, one per line");
		jsap.registerParameter(lsw);

		Switch isw = new Switch("interactive",
				'i',
				"interactive",
				"learn a grammar over --states, asking the user every question on the console. "+
		"Takes no files");
		jsap.registerParameter(isw);

		// MODE MODIFIERS

		Switch dsw = new Switch("derive",
				'd',
				"derive",
		"when recognizing, print a derivation tree for each string instead of the number of steps");
		jsap.registerParameter(dsw);

		FlaggedOption sampleopt = new FlaggedOption("samples",
				IntegerStringParser.getParser(),
				"30",
				false,
				JSAP.NO_SHORTFLAG,
				"samples",
		"with -l, how many strings of each hypothesis are checked against the target. Default is 30");
		jsap.registerParameter(sampleopt);

		FlaggedOption statesopt = new FlaggedOption("states",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"states",
		"with -i, the space separated states to learn over, for example \"S A B\"");
		jsap.registerParameter(statesopt);

		FlaggedOption startopt = new FlaggedOption("start",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"start",
		"with -i, the start state. Default is the first of --states");
		jsap.registerParameter(startopt);

		FlaggedOption maxiteropt = new FlaggedOption("maxiter",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"max-iterations",
		"with -l or -i, give up after this many hypotheses");
		jsap.registerParameter(maxiteropt);

		Switch vsw = new Switch("verbose",
				'v',
				"verbose",
		"with -l or -i, print every query and answer to stderr");
		jsap.registerParameter(vsw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
		"print timing information to stderr at this level of detail (1 or 2)");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write output grammar or string list or summary. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				false,
				true,
				"input files. With no mode: a grammar and a file of strings to recognize, one per line "+
				"(*e* for the empty string). With -k or -c: a grammar. With -l: a target grammar and "+
		"a file of positive examples");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.getBoolean("help") || !config.success())
			return config;

		// make sure there aren't too many switches on
		int numActive = 0;
		if (config.contains("enumerate"))
			numActive++;
		if (config.getBoolean("check"))
			numActive++;
		if (config.getBoolean("learn"))
			numActive++;
		if (config.getBoolean("interactive"))
			numActive++;
		if (numActive > 1)
			throw new ConfigureException("Can have at most one of -k, -c, -l, -i arguments!");

		boolean learning = config.getBoolean("learn") || config.getBoolean("interactive");
		if (config.getBoolean("derive") && numActive > 0)
			throw new ConfigureException("-d only applies when recognizing strings");
		if ((config.contains("states") || config.contains("start")) && !config.getBoolean("interactive"))
			throw new ConfigureException("--states and --start only apply to -i");
		if (config.getBoolean("interactive") && !config.contains("states"))
			throw new ConfigureException("-i needs --states");
		if ((config.contains("maxiter") || config.getBoolean("verbose")) && !learning)
			throw new ConfigureException("--max-iterations and -v only apply to -l or -i");
		if (config.contains("enumerate") && config.getInt("enumerate") < 0)
			throw new ConfigureException("-k needs a non-negative number, not "+config.getInt("enumerate"));
		if (config.getInt("samples") < 1)
			throw new ConfigureException("--samples needs a positive number, not "+config.getInt("samples"));

		int files = config.contains("infiles") ? config.getFileArray("infiles").length : 0;
		int expected = 2;
		if (config.contains("enumerate") || config.getBoolean("check"))
			expected = 1;
		else if (config.getBoolean("interactive"))
			expected = 0;
		if (files != expected)
			throw new ConfigureException("Expected "+expected+" input file(s) but got "+files);
		return config;
	}

	// one token sequence per non-blank line. *e* is the empty string, % starts a comment
	static List<List<Symbol>> readStrings(BufferedReader br) throws IOException {
		ArrayList<List<Symbol>> ret = new ArrayList<List<Symbol>>();
		String line = null;
		while ((line = br.readLine()) != null) {
			int comment = line.indexOf('%');
			if (comment >= 0)
				line = line.substring(0, comment);
			if (line.trim().length() == 0)
				continue;
			ret.add(SymbolFactory.getTerminals(line));
		}
		br.close();
		return ret;
	}

	private static BufferedReader open(File f, String encoding) throws FileNotFoundException, IOException {
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	// do whatever the configuration asks, writing results to w
	static void run(JSAPResult config, BufferedReader stdin, PrintStream console, Writer w) throws ConfigureException,
	FileNotFoundException, IOException, DataFormatException, UnusualConditionException {
		String encoding = config.getString("encoding");
		File[] infiles = config.contains("infiles") ? config.getFileArray("infiles") : new File[0];
		int timeLevel = Debug.getDbLevel();
		Date readTime = new Date();

		if (config.getBoolean("interactive")) {
			List<Symbol> states = SymbolFactory.getStates(config.getString("states"));
			if (states.isEmpty())
				throw new ConfigureException("--states is empty");
			Symbol start = states.get(0);
			if (config.contains("start"))
				start = SymbolFactory.getState(config.getString("start"));
			if (!states.contains(start))
				throw new ConfigureException("Start state "+start+" is not one of "+states);
			InteractiveOracle io = new InteractiveOracle(stdin, console);
			learn(config, start, states, io, io, w);
			return;
		}

		CFGRuleSet grammar = new CFGRuleSet(infiles[0].getPath(), encoding);
		Debug.dbtime(timeLevel, 1, readTime, new Date(), "read grammar "+infiles[0].getName());

		if (config.getBoolean("check")) {
			check(grammar, w);
		}
		else if (config.contains("enumerate")) {
			int k = config.getInt("enumerate");
			Iterator<List<Symbol>> lang = new Recognizer(grammar).language();
			for (int i = 0; i < k && lang.hasNext(); i++)
				w.write(SymbolFactory.toYield(lang.next())+"\n");
		}
		else if (config.getBoolean("learn")) {
			if (!grammar.isCNF())
				throw new DataFormatException("Target grammar "+infiles[0].getName()+" is not in Chomsky normal form");
			List<List<Symbol>> corpus = readStrings(open(infiles[1], encoding));
			GrammarMembershipOracle target = new GrammarMembershipOracle(grammar);
			SampleCounterExampleOracle counter = new SampleCounterExampleOracle(target, grammar.getStartState(),
					corpus, config.getInt("samples"));
			learn(config, grammar.getStartState(), new ArrayList<Symbol>(grammar.getStates()), target, counter, w);
		}
		else {
			List<List<Symbol>> strings = readStrings(open(infiles[1], encoding));
			Recognizer r = new Recognizer(grammar);
			boolean derive = config.getBoolean("derive");
			for (List<Symbol> s : strings) {
				if (derive) {
					DerivationTree t = r.derive(s);
					w.write(t == null ? "no\n" : t.toString()+"\n");
				}
				else {
					Integer len = r.getDerivationLength(s);
					w.write(len == null ? "no\n" : "yes "+len+"\n");
				}
			}
		}
		w.flush();
	}

	private static void learn(JSAPResult config, Symbol start, List<Symbol> states,
			MembershipOracle member, CounterExampleOracle counter, Writer w) throws IOException, UnusualConditionException {
		CountingOracle co = new CountingOracle(member, counter, config.getBoolean("verbose"));
		KBoundedLearner learner = new KBoundedLearner(start, states, co, co);
		if (config.contains("maxiter"))
			learner.setMaxIterations(config.getInt("maxiter"));
		CFGRuleSet learned = learner.learn();
		learned.print(w);
		w.write("% "+learner.getIterations()+" hypotheses, "+co.getMemberCalls()+" membership queries, "+
				co.getCounterCalls()+" counterexample queries\n");
		if (!learner.getBlacklist().isEmpty())
			w.write("% "+learner.getBlacklist().size()+" leaves blacklisted\n");
		w.flush();
	}

	static void check(CFGRuleSet grammar, Writer w) throws IOException {
		Nullability nul = new Nullability(grammar);
		CFGRuleSet pruned = grammar.getPruned();
		w.write(grammar.getStates().size()+" states, "+grammar.getNumRules()+" rules, "+
				grammar.getTerminals().size()+" terminals\n");
		w.write("start: "+grammar.getStartState()+"\n");
		w.write("states:"+join(grammar.getStates())+"\n");
		w.write("terminals:"+join(grammar.getTerminals())+"\n");
		w.write("nullable:"+join(nul.getNullableStates())+"\n");
		w.write("useful rules: "+pruned.getNumRules()+"\n");
		w.write("CNF: "+(grammar.isCNF() ? "yes" : "no")+"\n");
		w.flush();
	}

	private static String join(Iterable<Symbol> syms) {
		StringBuffer sb = new StringBuffer();
		for (Symbol s : syms)
			sb.append(" ").append(s.toString());
		return sb.toString();
	}

	public static void main(String argv[]) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("CFGLearn options improperly configured: "+e.getMessage());
			System.err.println("Try 'cfglearn -h` for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("CFGLearn options improperly configured: "+e.getMessage());
			System.err.println("Try 'cfglearn -h` for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is CFGLearn, version "+VERSION);
			Debug.prettyDebug("Usage: cfglearn ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: cfglearn ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		try {
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			Date startTime = new Date();
			Writer w = null;
			if (config.contains("outfile"))
				w = new OutputStreamWriter(new FileOutputStream(config.getFile("outfile")), encoding);
			else
				w = new OutputStreamWriter(System.out, encoding);
			BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, encoding));
			run(config, stdin, System.out, w);
			w.close();
			Debug.dbtime(1, startTime, "total");
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Improper data specified: "+e.getMessage());
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("CFGLearn options improperly configured: "+e.getMessage());
			System.exit(1);
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			System.exit(1);
		}
	}
}
