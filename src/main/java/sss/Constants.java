package sss;

/**
 * Property tags understood by {@link sss.facade.SSSFacade}
 */
public class Constants {
    public final static String TAG_THRESHOLD = "threshold";
    public final static String TAG_PARTS = "parts";
    public final static String TAG_RANDOM_ALGORITHM = "randomAlgorithm";
}
