package io.doers.escrow.scheduler;

/**
 * Counts for one scheduler tick. {@code skipped} covers rows that no longer qualified by
 * the time they were written, typically because a person acted first.
 */
public class SweepSummary {

	private final String sweep;
	private final boolean ran;
	private int processed;
	private int skipped;
	private int failed;

	private SweepSummary(String sweep, boolean ran) {
		this.sweep = sweep;
		this.ran = ran;
	}

	public static SweepSummary started(String sweep) {
		return new SweepSummary(sweep, true);
	}

	public static SweepSummary notRun(String sweep) {
		return new SweepSummary(sweep, false);
	}

	void processed() {
		processed++;
	}

	void skipped() {
		skipped++;
	}

	void failed() {
		failed++;
	}

	public String getSweep() {
		return sweep;
	}

	public boolean isRan() {
		return ran;
	}

	public int getProcessed() {
		return processed;
	}

	public int getSkipped() {
		return skipped;
	}

	public int getFailed() {
		return failed;
	}

	@Override
	public String toString() {
		return String.format("SweepSummary{sweep=%s, ran=%s, processed=%d, skipped=%d, failed=%d}",
			sweep, ran, processed, skipped, failed);
	}
}
