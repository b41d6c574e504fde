package edu.isi.cfglearn;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// debugging and progress output. everything goes to stderr unless redirected
public class Debug {

	static String encoding = "utf-8";
	private static OutputStream dest = System.err;
	private static Writer w = null;

	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	// send output somewhere other than stderr (the cli uses this for -o on traces)
	public static void setStream(OutputStream os) {
		dest = os;
		initializeStream();
	}

	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(dest, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(dest);
		}
	}

	private static void write(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s);
			w.write("\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		write(s);
	}

	// true debugging stuff. callers guard with a local flag
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		debug(d, 0, caller(), s);
	}
	public static void debug(boolean d, int indent, String s) {
		if (!d)
			return;
		debug(d, indent, caller(), s);
	}
	private static void debug(boolean d, int indent, String caller, String s) {
		StringBuffer sb = new StringBuffer();
		for (int x = 0; x < indent; x++)
			sb.append(' ');
		sb.append(caller).append(" : ").append(s);
		write(sb.toString());
	}
	// two frames up: past debug() to whoever called it
	private static String caller() {
		StackTraceElement el = new Throwable().getStackTrace()[2];
		return el.getClassName()+":"+el.getMethodName();
	}

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	public static int getDbLevel() {
		return dblevel;
	}
	// print time debug info if the level is proper
	public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
		if (currlevel < needlevel)
			return;
		write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
	}

	// global version of dbtime
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(dblevel, needlevel, pta, new Date(), msg);
	}
}
