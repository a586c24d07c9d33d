package sss.benchmark;

/**
 * Accumulates elapsed time over a number of start/stop pairs
 */
public class Measurement {
	private final String name;
	private final int nTests;
	private long totalTime;
	private long start;

	public Measurement(String name, int nTests) {
		this.name = name;
		this.nTests = nTests;
	}

	public void start() {
		start = System.nanoTime();
	}

	public void stop() {
		totalTime += System.nanoTime() - start;
	}

	public long getTotalTime() {
		return totalTime;
	}

	public double getAverageInMillis(int nDecimals) {
		double temp = Math.pow(10, nDecimals);
		return Math.round(((double) totalTime / nTests / 1_000_000.0) * temp) / temp;
	}

	@Override
	public String toString() {
		return name + " [totalTime=" + totalTime + ", nTests=" + nTests + "]";
	}
}
