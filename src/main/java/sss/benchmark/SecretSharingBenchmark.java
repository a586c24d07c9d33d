package sss.benchmark;

import sss.secretsharing.ShamirSecretSharing;

import java.security.SecureRandom;
import java.util.Arrays;

public class SecretSharingBenchmark {
    private static final int nDecimals = 4;

    public static void main(String[] args) {
        if (args.length != 5) {
            System.out.println("USAGE: ... sss.benchmark.SecretSharingBenchmark " +
                    "<threshold> <parts> <secret size> <warm up iterations> <test iterations>");
            System.exit(-1);
        }

        int threshold = Integer.parseInt(args[0]);
        int parts = Integer.parseInt(args[1]);
        int secretSize = Integer.parseInt(args[2]);
        int warmUpIterations = Integer.parseInt(args[3]);
        int nTests = Integer.parseInt(args[4]);

        ShamirSecretSharing.validateParameters(parts, threshold);
        if (secretSize <= 0)
            throw new IllegalArgumentException("secret size must be positive");

        System.out.println("t = " + threshold);
        System.out.println("n = " + parts);
        System.out.println("secret size = " + secretSize);
        System.out.println();

        ShamirSecretSharing secretSharing = new ShamirSecretSharing(new SecureRandom());

        System.out.println("Warming up (" + warmUpIterations + " iterations)");
        if (warmUpIterations > 0)
            runTests(secretSharing, warmUpIterations, false, threshold, parts, secretSize);
        System.out.println("Running test (" + nTests + " iterations)");
        if (nTests > 0)
            runTests(secretSharing, nTests, true, threshold, parts, secretSize);
    }

    private static void runTests(ShamirSecretSharing secretSharing, int nTests, boolean printResults,
                                 int threshold, int parts, int secretSize) {
        SecureRandom rnd = new SecureRandom();
        Measurement mSplit = new Measurement("split", nTests);
        Measurement mReconstruct = new Measurement("reconstruct", nTests);

        for (int tn = 0; tn < nTests; tn++) {
            byte[] secret = new byte[secretSize];
            rnd.nextBytes(secret);

            mSplit.start();
            byte[][] shares = secretSharing.split(secret, parts, threshold);
            mSplit.stop();

            byte[][] minimumShares = Arrays.copyOf(shares, threshold);
            mReconstruct.start();
            byte[] recoveredSecret = secretSharing.reconstruct(minimumShares);
            mReconstruct.stop();

            if (!Arrays.equals(recoveredSecret, secret))
                throw new IllegalStateException("Recovered Secret is different");
        }

        if (printResults) {
            System.out.println("Split: " + mSplit.getAverageInMillis(nDecimals));
            System.out.println("Reconstruct: " + mReconstruct.getAverageInMillis(nDecimals));
        }
    }
}
