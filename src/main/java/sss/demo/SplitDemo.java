package sss.demo;

import org.bouncycastle.util.encoders.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sss.Configuration;
import sss.Constants;
import sss.facade.SSSFacade;
import sss.facade.SecretSharingException;
import sss.secretsharing.Share;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Splits a secret, prints the shares and reconstructs the secret from a random subset of them.
 * Usage: ... sss.demo.SplitDemo [secret]
 */
public class SplitDemo {
	private static final Logger logger = LoggerFactory.getLogger("demo");
	private static final String DEFAULT_SECRET = "Some super secret";

	public static void main(String[] args) {
		String secret = args.length == 0 ? DEFAULT_SECRET : args[0];

		Configuration configuration = Configuration.getInstance();
		Properties properties;
		if (configuration == null) {
			logger.warn("Using default configuration");
			properties = defaultProperties();
		} else {
			properties = configuration.toProperties();
		}

		try {
			SSSFacade facade = new SSSFacade(properties);
			Share[] shares = facade.share(secret.getBytes(StandardCharsets.UTF_8));

			System.out.println("Base64 encoded shares:");
			for (int i = 0; i < shares.length; i++) {
				System.out.println(i + ": " + Base64.toBase64String(shares[i].toByteArray()));
			}

			List<Share> shuffled = new ArrayList<>(Arrays.asList(shares));
			Collections.shuffle(shuffled);
			Share[] subset = shuffled.subList(0, facade.getThreshold()).toArray(new Share[0]);
			logger.info("Reconstructing from shareholders {}", shareholdersOf(subset));

			byte[] recovered = facade.combine(subset);
			System.out.println();
			System.out.println("Recovered string: " + new String(recovered, StandardCharsets.UTF_8));
		} catch (SecretSharingException e) {
			logger.error("Demo failed", e);
		}
	}

	private static Properties defaultProperties() {
		Properties properties = new Properties();
		properties.setProperty(Constants.TAG_PARTS, "5");
		properties.setProperty(Constants.TAG_THRESHOLD, "3");
		return properties;
	}

	private static List<Integer> shareholdersOf(Share[] shares) {
		List<Integer> shareholders = new ArrayList<>(shares.length);
		for (Share share : shares) {
			shareholders.add(share.getShareholder());
		}
		return shareholders;
	}
}
