package sss;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class ConfigurationTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @After
    public void resetPath() {
        Configuration.setConfigurationFilePath("config" + File.separator + "sss.config");
    }

    @Test
    public void testLoad() throws IOException {
        File file = write("# comment\n" +
                "sss.parts = 7\n" +
                "sss.threshold = 4\n" +
                "sss.random.algorithm = SHA1PRNG\n" +
                "malformed line\n");
        Configuration configuration = Configuration.load(file.getPath());
        assertEquals(7, configuration.getParts());
        assertEquals(4, configuration.getThreshold());
        assertEquals("SHA1PRNG", configuration.getRandomAlgorithm());

        Properties properties = configuration.toProperties();
        assertEquals("7", properties.getProperty(Constants.TAG_PARTS));
        assertEquals("4", properties.getProperty(Constants.TAG_THRESHOLD));
        assertEquals("SHA1PRNG", properties.getProperty(Constants.TAG_RANDOM_ALGORITHM));
    }

    @Test
    public void testDefaults() throws IOException {
        File file = write("sss.random.algorithm =\n");
        Configuration configuration = Configuration.load(file.getPath());
        assertEquals(5, configuration.getParts());
        assertEquals(3, configuration.getThreshold());
        assertNull(configuration.getRandomAlgorithm());
        assertNull(configuration.toProperties().getProperty(Constants.TAG_RANDOM_ALGORITHM));
    }

    @Test
    public void testUnknownProperty() throws IOException {
        File file = write("sss.colour = blue\n");
        try {
            Configuration.load(file.getPath());
            fail("Unknown property was accepted");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown property name: sss.colour", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNumber() throws IOException {
        Configuration.load(write("sss.parts = many\n").getPath());
    }

    @Test
    public void testGetInstance() throws IOException {
        File file = write("sss.parts = 9\n");
        Configuration.setConfigurationFilePath(file.getPath());
        Configuration configuration = Configuration.getInstance();
        assertEquals(9, configuration.getParts());
        assertSame(configuration, Configuration.getInstance());
    }

    @Test
    public void testGetInstanceMissingFile() {
        Configuration.setConfigurationFilePath(new File(folder.getRoot(), "missing.config").getPath());
        assertNull(Configuration.getInstance());
    }

    private File write(String content) throws IOException {
        File file = folder.newFile();
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
