package sss;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

public final class Configuration {
	private static final Logger logger = LoggerFactory.getLogger("sss");
	private static String configurationFilePath =
			"config" + File.separator + "sss.config";
	private int threshold = 3;
	private int parts = 5;
	private String randomAlgorithm;

	private static Configuration INSTANT;

	public static void setConfigurationFilePath(String configurationFilePath) {
		Configuration.configurationFilePath = configurationFilePath;
		INSTANT = null;
	}

	/**
	 * Returns configuration read from the configuration file, or null if the file cannot be read
	 */
	public static Configuration getInstance() {
		if (INSTANT == null) {
			try {
				INSTANT = load(configurationFilePath);
			} catch (IOException e) {
				logger.error("Failed to read configuration file {}", configurationFilePath, e);
			}
		}
		return INSTANT;
	}

	public static Configuration load(String configurationFilePath) throws IOException {
		return new Configuration(configurationFilePath);
	}

	private Configuration(String configurationFilePath) throws IOException {
		try (BufferedReader in = new BufferedReader(new FileReader(configurationFilePath))) {
			String line;
			while ((line = in.readLine()) != null) {
				if (line.startsWith("#")) {
					continue;
				}
				String[] tokens = line.split("=");
				if (tokens.length != 2)
					continue;
				String propertyName = tokens[0].trim();
				String value = tokens[1].trim();
				switch (propertyName) {
					case "sss.threshold":
						threshold = parseInt(propertyName, value);
						break;
					case "sss.parts":
						parts = parseInt(propertyName, value);
						break;
					case "sss.random.algorithm":
						randomAlgorithm = value.isEmpty() ? null : value;
						break;
					default:
						throw new IllegalArgumentException("Unknown property name: " + propertyName);
				}
			}
		}
		logger.debug("Loaded configuration from {}", configurationFilePath);
	}

	private static int parseInt(String propertyName, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Property " + propertyName + " has invalid value", e);
		}
	}

	public int getThreshold() {
		return threshold;
	}

	public int getParts() {
		return parts;
	}

	public String getRandomAlgorithm() {
		return randomAlgorithm;
	}

	/**
	 * Converts this configuration into properties accepted by {@link sss.facade.SSSFacade}
	 */
	public Properties toProperties() {
		Properties properties = new Properties();
		properties.setProperty(Constants.TAG_THRESHOLD, String.valueOf(threshold));
		properties.setProperty(Constants.TAG_PARTS, String.valueOf(parts));
		if (randomAlgorithm != null)
			properties.setProperty(Constants.TAG_RANDOM_ALGORITHM, randomAlgorithm);
		return properties;
	}
}
