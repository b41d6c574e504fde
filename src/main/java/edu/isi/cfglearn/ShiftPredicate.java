package edu.isi.cfglearn;

// decides whether a terminal may be consumed at a chart position
public interface ShiftPredicate {
	public boolean canShift(int index, Symbol sym);
}
